package com.jiralert.core.failure;

import com.jiralert.core.spi.failure.FailureCaseHandler;
import com.jiralert.core.spi.failure.FailureClassifier;

import java.util.Comparator;
import java.util.List;

public class RouterFailureClassifier implements FailureClassifier {

    private final List<FailureCaseHandler<?>> handlers;

    /** 未匹配时的默认分类 */
    private final Classification defaultClassification;

    public RouterFailureClassifier(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Classification.permanent(Category.UNKNOWN).withCode("UNHANDLED"));
    }

    public RouterFailureClassifier(List<FailureCaseHandler<?>> handlers, Classification defaultClassification) {
        this.handlers = handlers == null ? List.of() : List.copyOf(handlers);
        this.defaultClassification = defaultClassification;
    }

    /**
     * 同类型匹配时选择离异常类最近的处理器
     */
    @Override
    public Classification classify(Throwable t) {
        // 展开 cause 链 先本体, 再逐级cause
        for (Throwable e = t; e != null; e = e.getCause()) {
            FailureCaseHandler<?> matched = findBestHandler(e);
            if (matched != null) {
                return safeCall(matched, e);
            }
            // 自引用 cause 防止死循环
            if (e.getCause() == e) {
                break;
            }
        }
        return defaultClassification;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Classification safeCall(FailureCaseHandler h, Throwable e) {
        Classification c = h.execute(e);
        return c == null ? defaultClassification : c;
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e) {
        // 过滤 supports 再按继承层级深度排序
        return handlers.stream()
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++ d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
