package cn.bafuka.chatgc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 删除客户端返回值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionResponse {

    private DeletionResult result;

    /**
     * 平台建议的重试等待时间（仅 RATE_LIMITED 时可能存在）
     */
    private Duration retryAfter;

    /**
     * 平台返回的描述信息
     */
    private String description;

    public static DeletionResponse of(DeletionResult result) {
        return new DeletionResponse(result, null, null);
    }

    public static DeletionResponse of(DeletionResult result, String description) {
        return new DeletionResponse(result, null, description);
    }

    public static DeletionResponse rateLimited(Duration retryAfter, String description) {
        return new DeletionResponse(DeletionResult.RATE_LIMITED, retryAfter, description);
    }
}
