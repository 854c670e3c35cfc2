package com.asthralang.compiler.analysis;

/**
 * 语义错误分类，每类带稳定的错误码
 */
public enum ErrorKind {
    INVALID_EXPRESSION("E001"),
    TYPE_MISMATCH("E002"),
    TYPE_INFERENCE_FAILED("E003"),
    INVALID_TYPE("E004"),
    INTERNAL("E005"),
    UNSUPPORTED_DECLARATION("E006"),
    UNSUPPORTED_STATEMENT("E007"),
    UNSUPPORTED_EXPRESSION("E008"),
    UNDECLARED_IDENTIFIER("E009"),
    REDECLARATION("E010"),
    IMMUTABILITY_VIOLATION("E011"),
    VISIBILITY_VIOLATION("E012"),
    MISSING_ANNOTATION("E013"),
    ARITY_MISMATCH("E014"),
    FFI_INCOMPATIBLE_TYPE("E015"),
    UNKNOWN_FIELD("E016"),
    MISSING_FIELD("E017"),
    INVALID_ANNOTATION("E018"),
    INVALID_CONTROL_FLOW("E019"),
    MISSING_RETURN("E020"),
    UNSAFE_REQUIRED("E021");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
