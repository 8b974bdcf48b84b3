package com.ryuqq.wick.core.error;

/**
 * Wick SDK 예외의 공통 상위 타입.
 *
 * <p>모든 오류는 동기적이고 지역적입니다. 순수 결정적 계산이므로 재시도는 의미가 없으며,
 * 실패한 연산은 이전 상태를 변경하지 않습니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link ConfigurationException}: SpaceRegistry 오용 (WICK-CONFIG)</li>
 *   <li>{@link ExpressionParseException}: 잘못된 텍스트 입력 (WICK-PARSE)</li>
 *   <li>{@link SymmetryException}: 모순된 대칭성 선언 (WICK-SYMMETRY)</li>
 *   <li>{@link ResourceLimitException}: 전개 상한 초과 (WICK-LIMIT)</li>
 * </ul>
 *
 * <p>0 분모는 {@link ArithmeticException}으로 보고됩니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public abstract class WickException extends RuntimeException {

    private final String errorCode;

    protected WickException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected WickException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: WICK-PARSE)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
