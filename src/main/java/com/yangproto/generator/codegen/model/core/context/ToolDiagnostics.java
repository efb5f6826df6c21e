package com.yangproto.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors and schema-limitation warnings accumulated during a compiler run.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
}
