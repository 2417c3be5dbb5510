package com.example.intent.model;

public record Entity(String type, String value, double confidence) {}
