package io.agentnode.server.messaging;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * Value of the {@code ~transport.return_route} decorator of an inbound message.
 * <p>
 * {@link #ALL} and {@link #THREAD} ask the receiving agent to answer over the same network
 * exchange that carried the message instead of a separate outbound delivery.
 */
public enum ReturnRoute {
    /** No direct response; replies go through outbound delivery. */
    NONE(false),

    /** Every reply may be returned on this exchange. */
    ALL(true),

    /** Only replies on the message's thread may be returned on this exchange. */
    THREAD(true);

    public static final String DECORATOR = "~transport";
    public static final String FIELD = "return_route";

    private final boolean directResponse;

    ReturnRoute(boolean directResponse) {
        this.directResponse = directResponse;
    }

    public boolean isDirectResponse() {
        return directResponse;
    }

    /**
     * Parses the decorator value. Missing or unknown values mean {@link #NONE}.
     */
    public static ReturnRoute fromDecorator(@Nullable String value) {
        if (value == null) {
            return NONE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all":
                return ALL;
            case "thread":
                return THREAD;
            default:
                return NONE;
        }
    }
}
