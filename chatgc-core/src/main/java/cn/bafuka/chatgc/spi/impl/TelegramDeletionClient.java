package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.model.DeletionResponse;
import cn.bafuka.chatgc.model.DeletionResult;
import cn.bafuka.chatgc.spi.DeletionClient;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Telegram Bot API 删除客户端
 * 调用 deleteMessage 并把平台返回映射为 DeletionResult
 *
 * 错误映射：
 * 429 -> RATE_LIMITED（读取 parameters.retry_after）
 * 5xx / 网络错误 -> TRANSIENT_ERROR
 * 400 "message to delete not found" -> NOT_FOUND
 * 其他 4xx -> PERMISSION_DENIED
 */
@Slf4j
public class TelegramDeletionClient implements DeletionClient {

    private final RestTemplate restTemplate;

    private final URI deleteMessageUri;

    public TelegramDeletionClient(RestTemplate restTemplate, String apiBaseUrl, String botToken) {
        this.restTemplate = restTemplate;
        this.deleteMessageUri = URI.create(apiBaseUrl + "/bot" + botToken + "/deleteMessage");
    }

    @Override
    public DeletionResponse deleteMessage(long chatId, long messageId) {
        JSONObject body = new JSONObject(true);
        body.put("chat_id", chatId);
        body.put("message_id", messageId);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    deleteMessageUri, new HttpEntity<>(body.toJSONString(), headers), String.class);
            return classify(response.getStatusCodeValue(), response.getBody());

        } catch (HttpStatusCodeException e) {
            return classify(e.getRawStatusCode(), e.getResponseBodyAsString());

        } catch (ResourceAccessException e) {
            log.warn("调用 Telegram deleteMessage 网络异常: chatId={}, messageId={}, error={}",
                    chatId, messageId, e.getMessage());
            return DeletionResponse.of(DeletionResult.TRANSIENT_ERROR, e.getMessage());

        } catch (RestClientException e) {
            log.warn("调用 Telegram deleteMessage 失败: chatId={}, messageId={}, error={}",
                    chatId, messageId, e.getMessage());
            return DeletionResponse.of(DeletionResult.TRANSIENT_ERROR, e.getMessage());
        }
    }

    /**
     * 根据 HTTP 状态码和响应体分类结果
     *
     * @param status HTTP 状态码
     * @param body   响应体
     * @return 删除结果
     */
    DeletionResponse classify(int status, String body) {
        JSONObject json = parse(body);
        String description = json != null ? json.getString("description") : body;

        if (status >= 200 && status < 300 && (json == null || json.getBooleanValue("ok"))) {
            return DeletionResponse.of(DeletionResult.SUCCESS);
        }

        int code = json != null && json.containsKey("error_code") ? json.getIntValue("error_code") : status;

        if (code == 429) {
            Duration retryAfter = null;
            JSONObject parameters = json != null ? json.getJSONObject("parameters") : null;
            if (parameters != null && parameters.containsKey("retry_after")) {
                retryAfter = Duration.ofSeconds(parameters.getLongValue("retry_after"));
            }
            return DeletionResponse.rateLimited(retryAfter, description);
        }

        if (code >= 500) {
            return DeletionResponse.of(DeletionResult.TRANSIENT_ERROR, description);
        }

        if (code == 400 && description != null
                && description.toLowerCase(Locale.ROOT).contains("message to delete not found")) {
            return DeletionResponse.of(DeletionResult.NOT_FOUND, description);
        }

        if (code >= 400) {
            // 无权限、消息不可删除、机器人被移出群组等
            return DeletionResponse.of(DeletionResult.PERMISSION_DENIED, description);
        }

        return DeletionResponse.of(DeletionResult.TRANSIENT_ERROR, description);
    }

    private JSONObject parse(String body) {
        if (body == null || body.trim().isEmpty()) {
            return null;
        }
        try {
            return JSON.parseObject(body);
        } catch (RuntimeException e) {
            log.debug("Telegram 响应不是 JSON: {}", body);
            return null;
        }
    }
}
