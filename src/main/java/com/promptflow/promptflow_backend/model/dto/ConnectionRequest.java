package com.promptflow.promptflow_backend.model.dto;

public record ConnectionRequest(String source, String target, String sourceHandle, String targetHandle) {}
