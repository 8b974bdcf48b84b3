package com.ryuqq.wick.core.error;

/**
 * 표현식 텍스트 파싱 실패.
 *
 * <p>실패 위치(문자 오프셋)를 함께 보고합니다.</p>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public class ExpressionParseException extends WickException {

    public static final String ERROR_CODE = "WICK-PARSE";

    private final int position;

    public ExpressionParseException(String message, int position) {
        super(ERROR_CODE, message + " (at position " + position + ")");
        this.position = position;
    }

    public ExpressionParseException(String message, int position, Throwable cause) {
        super(ERROR_CODE, message + " (at position " + position + ")", cause);
        this.position = position;
    }

    /**
     * 오류가 발생한 입력 위치.
     *
     * @return 0부터 시작하는 문자 오프셋
     */
    public int getPosition() {
        return position;
    }
}
