package com.example.riskscan_backend.dto;

public record EntityMention(String text, String type) {}
