package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.model.DeletionResponse;
import cn.bafuka.chatgc.model.DeletionResult;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * TelegramDeletionClient 单元测试
 * 测试平台返回到 DeletionResult 的映射
 */
public class TelegramDeletionClientTest {

    private static final URI DELETE_URI = URI.create("https://api.telegram.org/botTOKEN/deleteMessage");

    @Mock
    private RestTemplate restTemplate;

    private TelegramDeletionClient client;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        client = new TelegramDeletionClient(restTemplate, "https://api.telegram.org", "TOKEN");
    }

    private HttpClientErrorException clientError(HttpStatus status, String body) {
        return HttpClientErrorException.create(status, status.getReasonPhrase(), new HttpHeaders(),
                body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    /**
     * 测试删除成功
     */
    @Test
    @SuppressWarnings("unchecked")
    public void testDeleteMessage_Success() {
        when(restTemplate.postForEntity(eq(DELETE_URI), any(HttpEntity.class), eq(String.class)))
                .thenReturn(ResponseEntity.ok("{\"ok\":true,\"result\":true}"));

        DeletionResponse response = client.deleteMessage(-1001, 42);

        assertEquals(DeletionResult.SUCCESS, response.getResult());

        ArgumentCaptor<HttpEntity> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForEntity(eq(DELETE_URI), captor.capture(), eq(String.class));
        String body = (String) captor.getValue().getBody();
        assertTrue(body.contains("\"chat_id\":-1001"));
        assertTrue(body.contains("\"message_id\":42"));
    }

    /**
     * 测试消息已不存在
     */
    @Test
    public void testDeleteMessage_NotFound() {
        when(restTemplate.postForEntity(eq(DELETE_URI), any(HttpEntity.class), eq(String.class)))
                .thenThrow(clientError(HttpStatus.BAD_REQUEST,
                        "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: message to delete not found\"}"));

        DeletionResponse response = client.deleteMessage(-1001, 42);

        assertEquals(DeletionResult.NOT_FOUND, response.getResult());
    }

    /**
     * 测试无删除权限
     */
    @Test
    public void testDeleteMessage_PermissionDenied() {
        when(restTemplate.postForEntity(eq(DELETE_URI), any(HttpEntity.class), eq(String.class)))
                .thenThrow(clientError(HttpStatus.BAD_REQUEST,
                        "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: message can't be deleted\"}"));

        assertEquals(DeletionResult.PERMISSION_DENIED, client.deleteMessage(-1001, 42).getResult());
    }

    /**
     * 测试被平台限流，读取 retry_after
     */
    @Test
    public void testDeleteMessage_RateLimited() {
        when(restTemplate.postForEntity(eq(DELETE_URI), any(HttpEntity.class), eq(String.class)))
                .thenThrow(clientError(HttpStatus.TOO_MANY_REQUESTS,
                        "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 7\","
                                + "\"parameters\":{\"retry_after\":7}}"));

        DeletionResponse response = client.deleteMessage(-1001, 42);

        assertEquals(DeletionResult.RATE_LIMITED, response.getResult());
        assertEquals(Duration.ofSeconds(7), response.getRetryAfter());
    }

    /**
     * 测试服务端错误按临时错误处理
     */
    @Test
    public void testDeleteMessage_ServerError() {
        when(restTemplate.postForEntity(eq(DELETE_URI), any(HttpEntity.class), eq(String.class)))
                .thenThrow(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "Bad Gateway",
                        new HttpHeaders(), new byte[0], StandardCharsets.UTF_8));

        assertEquals(DeletionResult.TRANSIENT_ERROR, client.deleteMessage(-1001, 42).getResult());
    }

    /**
     * 测试网络异常按临时错误处理
     */
    @Test
    public void testDeleteMessage_NetworkError() {
        when(restTemplate.postForEntity(eq(DELETE_URI), any(HttpEntity.class), eq(String.class)))
                .thenThrow(new ResourceAccessException("Connection reset"));

        assertEquals(DeletionResult.TRANSIENT_ERROR, client.deleteMessage(-1001, 42).getResult());
    }

    /**
     * 测试分类规则
     */
    @Test
    public void testClassify() {
        assertEquals(DeletionResult.SUCCESS, client.classify(200, "{\"ok\":true}").getResult());
        assertEquals(DeletionResult.PERMISSION_DENIED, client.classify(403,
                "{\"ok\":false,\"error_code\":403,\"description\":\"Forbidden: bot was kicked\"}").getResult());
        assertEquals(DeletionResult.TRANSIENT_ERROR, client.classify(500, "not json").getResult());
        // 429 但没有 retry_after
        DeletionResponse limited = client.classify(429, "");
        assertEquals(DeletionResult.RATE_LIMITED, limited.getResult());
        assertNull(limited.getRetryAfter());
    }
}
