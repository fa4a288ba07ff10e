package io.github.cyfko.celldl.core.ast;

/**
 * Enum constant spelled by a fixed DSL word.
 */
public interface DslKeyword {

    /** Spelling in source text, e.g. {@code "local-sts"}. */
    String keyword();

    /**
     * Constant of {@code type} spelled {@code keyword}.
     *
     * @return the constant, or {@code null} when no constant has that spelling
     */
    static <E extends Enum<E> & DslKeyword> E lookup(Class<E> type, String keyword) {
        if (keyword == null) {
            return null;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.keyword().equals(keyword)) {
                return constant;
            }
        }
        return null;
    }
}
