package uz.sonic.continuum.model;

public interface PushPayload {

    String repositoryUrl();

    String repositoryName();
}
