package com.ryuqq.wick.core.error;

/**
 * Wick 전개 또는 정규형 탐색이 호출자가 설정한 상한을 넘은 경우.
 *
 * <p>스택 오버플로나 메모리 고갈 대신 명시적으로 보고합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public class ResourceLimitException extends WickException {

    public static final String ERROR_CODE = "WICK-LIMIT";

    private final long limit;

    public ResourceLimitException(String message, long limit) {
        super(ERROR_CODE, message + " (limit: " + limit + ")");
        this.limit = limit;
    }

    public long getLimit() {
        return limit;
    }
}
