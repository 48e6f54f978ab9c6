package com.deepknow.tutor.domain.relay;

import com.deepknow.tutor.domain.relay.event.FunctionCallArgumentsDelta;
import com.deepknow.tutor.domain.relay.event.FunctionCallArgumentsDone;

/**
 * Realtime 协议中本系统需要识别或构造的事件类型。
 */
public final class EventTypes {
    public static final String INPUT_AUDIO_BUFFER_APPEND = "input_audio_buffer.append";
    public static final String INPUT_AUDIO_BUFFER_COMMIT = "input_audio_buffer.commit";
    public static final String RESPONSE_CANCEL = "response.cancel";
    public static final String CONVERSATION_ITEM_TRUNCATE = "conversation.item.truncate";
    public static final String RESPONSE_CREATE = "response.create";
    public static final String CONVERSATION_ITEM_CREATE = "conversation.item.create";
    public static final String SESSION_UPDATE = "session.update";

    public static final String FUNCTION_CALL_ARGUMENTS_DELTA = FunctionCallArgumentsDelta.TYPE;
    public static final String FUNCTION_CALL_ARGUMENTS_DONE = FunctionCallArgumentsDone.TYPE;

    public static final String ERROR = "error";

    private EventTypes() {}
}
