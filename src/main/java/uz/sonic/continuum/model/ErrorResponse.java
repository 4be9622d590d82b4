package uz.sonic.continuum.model;

public record ErrorResponse(String detail) {}
