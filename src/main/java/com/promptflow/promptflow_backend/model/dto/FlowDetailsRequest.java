package com.promptflow.promptflow_backend.model.dto;

/** Name and description of a flow, for create and rename. */
public record FlowDetailsRequest(String name, String description) {}
