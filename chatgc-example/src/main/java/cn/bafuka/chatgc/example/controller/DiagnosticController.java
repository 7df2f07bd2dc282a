package cn.bafuka.chatgc.example.controller;

import cn.bafuka.chatgc.core.DeletionStats;
import cn.bafuka.chatgc.engine.DeletionEngine;
import cn.bafuka.chatgc.example.service.SimulatedDeletionClient;
import cn.bafuka.chatgc.model.PendingDeletion;
import cn.bafuka.chatgc.queue.ExpiryQueue;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRuleManager;
import com.alibaba.csp.sentinel.slots.block.flow.param.ParamFlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.param.ParamFlowRuleManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 诊断控制器
 * 用于查看 ChatGC 的运行状态
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private DeletionEngine deletionEngine;

    @Autowired
    private ExpiryQueue expiryQueue;

    @Autowired(required = false)
    private SimulatedDeletionClient simulatedDeletionClient;

    /**
     * 引擎统计
     */
    @GetMapping("/stats")
    public Map<String, Object> stats() {
        DeletionStats stats = deletionEngine.stats();
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("stats", stats);
        result.put("successRate", String.format("%.2f%%", stats.successRate() * 100));
        return result;
    }

    /**
     * 查看到期队列（按 dueAt 升序）
     */
    @GetMapping("/queue")
    public Map<String, Object> queue(@RequestParam(defaultValue = "50") int limit) {
        List<Map<String, Object>> entries = expiryQueue.snapshot().stream()
                .limit(limit)
                .map(this::describe)
                .collect(Collectors.toList());

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("total", expiryQueue.size());
        result.put("entries", entries);
        return result;
    }

    /**
     * 查看 Sentinel 限流规则
     */
    @GetMapping("/sentinel-rules")
    public Map<String, Object> sentinelRules() {
        List<FlowRule> flowRules = FlowRuleManager.getRules();
        List<ParamFlowRule> paramRules = ParamFlowRuleManager.getRules();

        List<Map<String, Object>> paramDetails = paramRules.stream().map(rule -> {
            Map<String, Object> detail = new HashMap<>();
            detail.put("resource", rule.getResource());
            detail.put("paramIdx", rule.getParamIdx());
            detail.put("count", rule.getCount());
            detail.put("durationInSec", rule.getDurationInSec());
            return detail;
        }).collect(Collectors.toList());

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("flowRules", flowRules);
        result.put("paramFlowRules", paramDetails);

        if (flowRules.isEmpty() && paramRules.isEmpty()) {
            result.put("warning", "没有找到 Sentinel 规则，请检查限流配置");
        }
        return result;
    }

    /**
     * 模拟客户端已删除的消息
     */
    @GetMapping("/deleted")
    public Map<String, Object> deleted() {
        Map<String, Object> result = new HashMap<>();
        if (simulatedDeletionClient == null) {
            result.put("success", false);
            result.put("message", "当前使用 Telegram 客户端，没有模拟删除记录");
            return result;
        }
        result.put("success", true);
        result.put("deleted", simulatedDeletionClient.getDeleted().stream()
                .map(Object::toString)
                .collect(Collectors.toList()));
        return result;
    }

    /**
     * 健康检查
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        DeletionStats stats = deletionEngine.stats();
        boolean healthy = !FlowRuleManager.getRules().isEmpty();

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("queueSize", stats.getQueueSize());
        result.put("abandoned", stats.getAbandonedCount());
        result.put("healthy", healthy);
        result.put("message", healthy ? "ChatGC 运行正常" : "警告：限流规则未加载");
        return result;
    }

    private Map<String, Object> describe(PendingDeletion record) {
        Map<String, Object> entry = new HashMap<>();
        entry.put("key", record.getKey().asString());
        entry.put("state", record.getState());
        entry.put("attempts", record.getAttemptCount());
        entry.put("deadline", String.valueOf(record.getDeadline()));
        entry.put("dueAt", String.valueOf(record.getDueAt()));
        entry.put("lastError", record.getLastError());
        return entry;
    }
}
