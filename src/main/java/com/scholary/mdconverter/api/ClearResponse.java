package com.scholary.mdconverter.api;

/** Acknowledgement for a status clear. */
public record ClearResponse(boolean success) {}
