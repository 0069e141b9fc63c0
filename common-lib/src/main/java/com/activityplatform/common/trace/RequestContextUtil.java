package com.activityplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the voting group's identifier through reactive pipelines.
 *
 * <p>The Reactor Context is the source of truth for {@code groupId}. MDC is written only as a
 * temporary bridge around a single log statement, never as a lasting ThreadLocal store, because
 * member scoring hops between scheduler threads.
 *
 * <pre>
 *     return RequestContextUtil.withGroupId(pipeline, request.groupId());
 *     ...
 *     signal -> RequestContextUtil.getGroupId(signal.getContextView())
 * </pre>
 */
public final class RequestContextUtil {

    public static final String GROUP_ID_KEY = "groupId";

    private static final String UNKNOWN = "unknown";

    private RequestContextUtil() {}

    /**
     * Stores {@code groupId} in the Reactor Context. {@code contextWrite} propagates upstream
     * during subscription, so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withGroupId(Mono<T> mono, String groupId) {
        return mono.contextWrite(ctx -> ctx.put(GROUP_ID_KEY, groupId != null ? groupId : UNKNOWN));
    }

    /** Same as {@link #withGroupId(Mono, String)} for per-member fan-outs that emit many values. */
    public static <T> Flux<T> withGroupId(Flux<T> flux, String groupId) {
        return flux.contextWrite(ctx -> ctx.put(GROUP_ID_KEY, groupId != null ? groupId : UNKNOWN));
    }

    /** @return the groupId, or {@code "unknown"} when absent; never {@code null} */
    public static String getGroupId(ContextView ctx) {
        return ctx.getOrDefault(GROUP_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code groupId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String groupId, Runnable logAction) {
        String previous = MDC.get(GROUP_ID_KEY);
        MDC.put(GROUP_ID_KEY, groupId != null ? groupId : UNKNOWN);
        try {
            logAction.run();
        } finally {
            if (previous != null) {
                MDC.put(GROUP_ID_KEY, previous);
            } else {
                MDC.remove(GROUP_ID_KEY);
            }
        }
    }

    /** Reads the groupId from {@code ctx} and bridges it into MDC around {@code logAction}. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(getGroupId(ctx), logAction);
    }
}
