package com.ryuqq.wick.core.canonical;

import com.ryuqq.wick.core.model.Operator;
import com.ryuqq.wick.core.model.TensorLabel;
import com.ryuqq.wick.core.model.Term;
import com.ryuqq.wick.core.space.Index;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 정규형 Term의 비교 가능한 키.
 *
 * <p>문자열 연결이 아닌 구조화된 토큰 열이며, (종류, label, ordinal) 순서의 사전식 비교를 따릅니다.
 * 따라서 {@code o10}은 {@code o2}보다 뒤에 옵니다.</p>
 *
 * <pre>
 * T^{o0,o1}_{v0,v1} { a+(v0) a+(v1) a-(o1) a-(o0) }
 *   → [TENSOR(T:A,2), INDEX(o,0), INDEX(o,1), LOWER(2), INDEX(v,0), INDEX(v,1),
 *      BRACE(1), CREATION(v,0), CREATION(v,1), ANNIHILATION(o,1), ANNIHILATION(o,0)]
 * </pre>
 *
 * @author Wick Team
 * @since 1.0.0
 */
public final class TermKey implements Comparable<TermKey> {

    /**
     * 토큰 종류 (선언 순서가 비교 순서).
     */
    public enum TokenKind {
        TENSOR,
        INDEX,
        LOWER,
        BRACE,
        CREATION,
        ANNIHILATION
    }

    /**
     * 키 토큰.
     *
     * @param kind 종류
     * @param label 텐서 이름 또는 공간 label
     * @param ordinal index ordinal 또는 슬롯 개수
     */
    public record Token(TokenKind kind, String label, int ordinal) implements Comparable<Token> {

        @Override
        public int compareTo(Token other) {
            int byKind = kind.compareTo(other.kind);
            if (byKind != 0) {
                return byKind;
            }
            int byLabel = label.compareTo(other.label);
            return byLabel != 0 ? byLabel : Integer.compare(ordinal, other.ordinal);
        }

        @Override
        public String toString() {
            return kind.name() + "(" + label + "," + ordinal + ")";
        }
    }

    private final List<Token> tokens;

    private TermKey(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Term 본문(계수 제외)의 키. 입력 Term은 이미 정규형이어야 합니다.
     *
     * @param canonical 정규형 Term
     * @return TermKey
     */
    public static TermKey of(Term canonical) {
        List<Token> tokens = new ArrayList<>();
        for (TensorLabel tensor : canonical.getTensors()) {
            appendTensor(tokens, tensor);
        }
        appendOperators(tokens, canonical.getOperators(), canonical.isNormalOrdered());
        return new TermKey(tokens);
    }

    static TermKey ofTokens(List<Token> tokens) {
        return new TermKey(tokens);
    }

    static void appendTensor(List<Token> tokens, TensorLabel tensor) {
        tokens.add(new Token(TokenKind.TENSOR, tensor.name() + ":" + tensor.symmetry().name().charAt(0),
            tensor.upper().size()));
        for (Index index : tensor.upper()) {
            tokens.add(new Token(TokenKind.INDEX, index.getLabel(), index.getOrdinal()));
        }
        tokens.add(new Token(TokenKind.LOWER, "", tensor.lower().size()));
        for (Index index : tensor.lower()) {
            tokens.add(new Token(TokenKind.INDEX, index.getLabel(), index.getOrdinal()));
        }
    }

    static void appendOperators(List<Token> tokens, List<Operator> operators, boolean normalOrdered) {
        if (operators.isEmpty()) {
            return;
        }
        tokens.add(new Token(TokenKind.BRACE, "", normalOrdered ? 1 : 0));
        for (Operator operator : operators) {
            TokenKind kind = operator.isCreation() ? TokenKind.CREATION : TokenKind.ANNIHILATION;
            tokens.add(new Token(kind, operator.index().getLabel(), operator.index().getOrdinal()));
        }
    }

    /**
     * 접두부 비교: {@code partial}을 {@code reference}의 같은 길이 접두부와 비교.
     */
    static int comparePrefix(List<Token> partial, List<Token> reference) {
        int length = Math.min(partial.size(), reference.size());
        for (int i = 0; i < length; i++) {
            int cmp = partial.get(i).compareTo(reference.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    @Override
    public int compareTo(TermKey other) {
        int cmp = comparePrefix(tokens, other.tokens);
        return cmp != 0 ? cmp : Integer.compare(tokens.size(), other.tokens.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return tokens.equals(((TermKey) o).tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return tokens.stream().map(Token::toString).collect(Collectors.joining(" ", "TermKey{", "}"));
    }
}
