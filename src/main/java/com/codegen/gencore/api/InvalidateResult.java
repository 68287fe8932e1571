package com.codegen.gencore.api;

public enum InvalidateResult {
    OK,
    /** The step key was never recorded. */
    NOT_FOUND
}
