package com.fhylang.compiler.ast.type;

/**
 * Built-in element types of numerical values.
 */
public enum CoreDataType {
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    FLOAT16("float16"),
    FLOAT32("float32"),
    FLOAT64("float64"),
    COMPLEX32("complex32"),
    COMPLEX64("complex64"),
    COMPLEX128("complex128");

    private final String keyword;

    CoreDataType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static CoreDataType fromKeyword(String keyword) {
        for (CoreDataType t : values()) {
            if (t.keyword.equals(keyword)) {
                return t;
            }
        }
        return null;
    }
}
