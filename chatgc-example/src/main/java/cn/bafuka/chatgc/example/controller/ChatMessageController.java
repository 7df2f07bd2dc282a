package cn.bafuka.chatgc.example.controller;

import cn.bafuka.chatgc.engine.DeletionEngine;
import cn.bafuka.chatgc.exception.ConfigurationException;
import cn.bafuka.chatgc.model.ChatDeletionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 群组消息控制器
 * 模拟入站层：新消息到达、手动删除、群组停用 TTL、重试放弃记录
 */
@Slf4j
@RestController
@RequestMapping("/api/chats/{chatId}")
public class ChatMessageController {

    @Autowired
    private DeletionEngine deletionEngine;

    /**
     * 新消息到达
     * 指定 ttlSeconds 时直接调度，否则按群组策略调度
     */
    @PostMapping("/messages/{messageId}")
    public Map<String, Object> onMessage(@PathVariable long chatId,
                                         @PathVariable long messageId,
                                         @RequestParam(required = false) Long ttlSeconds) {
        Map<String, Object> result = new HashMap<>();
        try {
            boolean scheduled = ttlSeconds == null
                    ? deletionEngine.onMessage(chatId, messageId, Instant.now())
                    : deletionEngine.schedule(chatId, messageId, Duration.ofSeconds(ttlSeconds));
            result.put("success", true);
            result.put("scheduled", scheduled);
        } catch (ConfigurationException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
        }
        return result;
    }

    /**
     * 取消单条消息的删除
     */
    @DeleteMapping("/messages/{messageId}")
    public Map<String, Object> cancel(@PathVariable long chatId, @PathVariable long messageId) {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("cancelled", deletionEngine.cancel(chatId, messageId));
        return result;
    }

    /**
     * 取消群组全部待删除记录
     */
    @DeleteMapping("/messages")
    public Map<String, Object> cancelChat(@PathVariable long chatId) {
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("cancelled", deletionEngine.cancelChat(chatId));
        return result;
    }

    /**
     * 重试被放弃的记录
     */
    @PostMapping("/retry")
    public Map<String, Object> retry(@PathVariable long chatId,
                                     @RequestParam(required = false) Integer maxAttempts) {
        int rescheduled = deletionEngine.retryAbandoned(chatId, maxAttempts);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("rescheduled", rescheduled);
        if (rescheduled == 0) {
            result.put("message", "没有需要重试的记录");
        }
        return result;
    }

    /**
     * 群组删除状态
     */
    @GetMapping("/status")
    public Map<String, Object> status(@PathVariable long chatId) {
        ChatDeletionStatus status = deletionEngine.status(chatId);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("enabled", status.getTtl() != null);
        result.put("ttlSeconds", status.getTtl() == null ? null : status.getTtl().getSeconds());
        result.put("scheduled", status.getScheduledCount());
        result.put("inFlight", status.getInFlightCount());
        result.put("abandoned", status.getAbandonedCount());
        result.put("nextDueAt", status.getNextDueAt() == null ? null : status.getNextDueAt().toString());
        return result;
    }
}
