package cn.bafuka.chatgc.spi.impl;

import cn.bafuka.chatgc.config.ChatGcProperties;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * LocalYamlChatPolicySource 单元测试
 */
public class LocalYamlChatPolicySourceTest {

    private ChatGcProperties properties;

    private LocalYamlChatPolicySource source;

    @Before
    public void setUp() {
        properties = new ChatGcProperties();
        properties.getPolicy().getChats().put(-1001L, 3600L);
        properties.getPolicy().getChats().put(-1002L, -1L);
        source = new LocalYamlChatPolicySource(properties);
    }

    /**
     * 测试读取本地群组策略
     */
    @Test
    public void testGetTtl() {
        assertEquals(Duration.ofHours(1), source.getTtl(-1001).get());
        // 负数视为未启用
        assertFalse(source.getTtl(-1002).isPresent());
        assertFalse(source.getTtl(-1003).isPresent());
    }

    /**
     * 测试订阅时通知当前策略
     */
    @Test
    public void testSubscribe() {
        List<Map<Long, Duration>> notifications = new ArrayList<>();
        source.subscribe(notifications::add);

        assertEquals(1, notifications.size());
        assertEquals(1, notifications.get(0).size());
        assertEquals("local", source.getType());
    }

    /**
     * 测试未配置策略
     */
    @Test
    public void testNoPolicies() {
        properties.getPolicy().getChats().clear();

        List<Map<Long, Duration>> notifications = new ArrayList<>();
        source.subscribe(notifications::add);

        assertTrue(notifications.isEmpty());
        assertFalse(source.getTtl(-1001).isPresent());
    }
}
