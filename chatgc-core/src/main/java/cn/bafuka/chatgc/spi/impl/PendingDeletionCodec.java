package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.model.DeletionState;
import cn.bafuka.chatgc.model.PendingDeletion;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;

import java.time.Instant;

/**
 * 待删除记录的 JSON 编解码
 * 时间字段以毫秒时间戳存储
 */
final class PendingDeletionCodec {

    private PendingDeletionCodec() {
    }

    static String encode(PendingDeletion record) {
        JSONObject json = new JSONObject(true);
        json.put("chatId", record.getChatId());
        json.put("messageId", record.getMessageId());
        json.put("postedAt", toMillis(record.getPostedAt()));
        json.put("deadline", toMillis(record.getDeadline()));
        json.put("dueAt", toMillis(record.getDueAt()));
        json.put("attemptCount", record.getAttemptCount());
        json.put("state", record.getState() != null ? record.getState().name() : null);
        json.put("lastError", record.getLastError());
        json.put("createdAt", toMillis(record.getCreatedAt()));
        json.put("updatedAt", toMillis(record.getUpdatedAt()));
        return json.toJSONString();
    }

    static PendingDeletion decode(String value) {
        JSONObject json = JSON.parseObject(value);
        String state = json.getString("state");
        return PendingDeletion.builder()
                .chatId(json.getLongValue("chatId"))
                .messageId(json.getLongValue("messageId"))
                .postedAt(toInstant(json.getLong("postedAt")))
                .deadline(toInstant(json.getLong("deadline")))
                .dueAt(toInstant(json.getLong("dueAt")))
                .attemptCount(json.getIntValue("attemptCount"))
                .state(state != null ? DeletionState.valueOf(state) : null)
                .lastError(json.getString("lastError"))
                .createdAt(toInstant(json.getLong("createdAt")))
                .updatedAt(toInstant(json.getLong("updatedAt")))
                .build();
    }

    private static Long toMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    private static Instant toInstant(Long millis) {
        return millis != null ? Instant.ofEpochMilli(millis) : null;
    }
}
