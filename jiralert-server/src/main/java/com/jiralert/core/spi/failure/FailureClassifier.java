package com.jiralert.core.spi.failure;

import lombok.Getter;

/**
 * 失败分类器 按异常类型判定是否可重试
 * 必须确定且完备：任何异常都只落入一个桶
 */
public interface FailureClassifier {

    Classification classify(Throwable t);

    @Getter
    final class Classification {
        private final boolean retryable;
        private final Category category;
        private final String code;

        private Classification(boolean retryable, Category category, String code) {
            this.retryable = retryable; this.category = category; this.code = code;
        }
        public static Classification retryable(Category c) { return new Classification(true, c, null); }
        public static Classification permanent(Category c) { return new Classification(false, c, null); }
        public Classification withCode(String code) { return new Classification(retryable, category, code); }

        @Override
        public String toString() {
            return (retryable ? "RETRYABLE" : "PERMANENT") + "/" + category + (code == null ? "" : "/" + code);
        }
    }

    enum Category { TIMEOUT, OPEN_CIRCUIT, RATE_LIMITED, BULKHEAD_FULL, IO, UNAVAILABLE, REJECTED, CONSTRUCTION, UNKNOWN }
}
