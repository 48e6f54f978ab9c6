package com.deepknow.tutor.domain.relay;

import java.util.Set;

/**
 * 客户端可转发至上游的事件类型白名单。集合固定，进程内只读。
 */
public final class ClientEventWhitelist {
    private static final Set<String> ALLOWED = Set.of(
            EventTypes.INPUT_AUDIO_BUFFER_APPEND,
            EventTypes.INPUT_AUDIO_BUFFER_COMMIT,
            EventTypes.RESPONSE_CANCEL,
            EventTypes.CONVERSATION_ITEM_TRUNCATE,
            EventTypes.RESPONSE_CREATE,
            EventTypes.CONVERSATION_ITEM_CREATE,
            EventTypes.SESSION_UPDATE
    );

    private ClientEventWhitelist() {}

    public static boolean isAllowed(String eventType) {
        return eventType != null && ALLOWED.contains(eventType);
    }

    public static Set<String> allowedTypes() {
        return ALLOWED;
    }
}
