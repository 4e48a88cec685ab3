package com.apsentinel.detection.trace;

import java.util.Optional;
import java.util.UUID;
import org.slf4j.MDC;

public final class RequestContextHolder {

    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_TENANT_ID = "tenant_id";

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    /**
     * Attach the tenant addressed by the current request, keeping the trace id.
     */
    public static void setTenantId(UUID tenantId) {
        RequestContext current = CONTEXT.get();
        CONTEXT.set(RequestContext.builder()
                .traceId(current != null ? current.traceId() : null)
                .tenantId(tenantId)
                .build());
        if (tenantId != null) {
            MDC.put(MDC_TENANT_ID, tenantId.toString());
        }
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static String currentTraceId() {
        return get().map(RequestContext::traceId).orElse(null);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(UUID tenantId, String traceId) {

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private UUID tenantId;
            private String traceId;

            public Builder tenantId(UUID tenantId) {
                this.tenantId = tenantId;
                return this;
            }

            public Builder traceId(String traceId) {
                this.traceId = traceId;
                return this;
            }

            public RequestContext build() {
                return new RequestContext(tenantId, traceId);
            }
        }
    }
}
