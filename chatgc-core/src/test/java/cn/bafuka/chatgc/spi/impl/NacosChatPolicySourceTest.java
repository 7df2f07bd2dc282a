package cn.bafuka.chatgc.spi.impl;

import com.alibaba.nacos.api.config.ConfigService;
import com.alibaba.nacos.api.config.listener.Listener;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * NacosChatPolicySource 单元测试
 */
public class NacosChatPolicySourceTest {

    private static final String DATA_ID = "chatgc-policies.json";

    private static final String GROUP = "DEFAULT_GROUP";

    @Mock
    private ConfigService configService;

    private NacosChatPolicySource source;

    private final List<Map<Long, Duration>> notifications = new ArrayList<>();

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        source = new NacosChatPolicySource(configService, DATA_ID, GROUP);
    }

    /**
     * 测试订阅时加载初始配置并注册监听器
     */
    @Test
    public void testSubscribe_InitialLoad() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000))
                .thenReturn("{\"-1001\": 3600, \"-1002\": 60}");

        source.subscribe(notifications::add);

        assertEquals(Duration.ofHours(1), source.getTtl(-1001).get());
        assertEquals(Duration.ofSeconds(60), source.getTtl(-1002).get());
        assertFalse(source.getTtl(-1003).isPresent());
        assertEquals(1, notifications.size());
        verify(configService).addListener(eq(DATA_ID), eq(GROUP), any(Listener.class));
    }

    /**
     * 测试配置变更通知
     */
    @Test
    public void testConfigChange_ListenerNotified() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn("{\"-1001\": 3600}");
        source.subscribe(notifications::add);

        ArgumentCaptor<Listener> captor = ArgumentCaptor.forClass(Listener.class);
        verify(configService).addListener(eq(DATA_ID), eq(GROUP), captor.capture());

        // 群组 -1001 停用，-1002 启用
        captor.getValue().receiveConfigInfo("{\"-1002\": 120}");

        assertFalse(source.getTtl(-1001).isPresent());
        assertEquals(Duration.ofSeconds(120), source.getTtl(-1002).get());
        assertEquals(2, notifications.size());
    }

    /**
     * 测试非法配置保留上一次的策略
     */
    @Test
    public void testConfigChange_InvalidJsonKeepsPrevious() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn("{\"-1001\": 3600}");
        source.subscribe(notifications::add);

        source.handleConfigChange("not json {");

        assertEquals(Duration.ofHours(1), source.getTtl(-1001).get());
        assertEquals(1, notifications.size());
    }

    /**
     * 测试空配置清空策略
     */
    @Test
    public void testConfigChange_EmptyClearsPolicies() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn("{\"-1001\": 3600}");
        source.subscribe(notifications::add);

        source.handleConfigChange("");

        assertFalse(source.getTtl(-1001).isPresent());
        assertTrue(notifications.get(notifications.size() - 1).isEmpty());
    }

    /**
     * 测试负数 TTL 被忽略
     */
    @Test
    public void testConfigChange_NegativeTtlSkipped() {
        source.handleConfigChange("{\"-1001\": -5, \"-1002\": 0}");

        assertFalse(source.getTtl(-1001).isPresent());
        assertEquals(Duration.ZERO, source.getTtl(-1002).get());
    }

    /**
     * 测试关闭时移除监听器
     */
    @Test
    public void testShutdown_RemovesListener() throws Exception {
        when(configService.getConfig(DATA_ID, GROUP, 5000)).thenReturn(null);
        source.subscribe(notifications::add);

        source.shutdown();

        verify(configService).removeListener(eq(DATA_ID), eq(GROUP), any(Listener.class));
        assertEquals("nacos", source.getType());
    }
}
