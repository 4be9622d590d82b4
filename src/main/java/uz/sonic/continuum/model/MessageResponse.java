package uz.sonic.continuum.model;

public record MessageResponse(String message) {}
