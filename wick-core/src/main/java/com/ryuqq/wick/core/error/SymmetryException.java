package com.ryuqq.wick.core.error;

/**
 * 같은 텐서 이름에 서로 다른 대칭성이 선언된 경우.
 *
 * @author Wick Team
 * @since 1.0.0
 */
public class SymmetryException extends WickException {

    public static final String ERROR_CODE = "WICK-SYMMETRY";

    public SymmetryException(String message) {
        super(ERROR_CODE, message);
    }
}
