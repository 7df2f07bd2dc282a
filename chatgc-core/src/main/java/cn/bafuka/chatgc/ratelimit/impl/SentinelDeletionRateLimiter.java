package cn.bafuka.chatgc.ratelimit.impl;

import cn.bafuka.chatgc.ratelimit.DeletionRateLimiter;
import com.alibaba.csp.sentinel.Entry;
import com.alibaba.csp.sentinel.EntryType;
import com.alibaba.csp.sentinel.SphU;
import com.alibaba.csp.sentinel.slots.block.BlockException;
import com.alibaba.csp.sentinel.slots.block.RuleConstant;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRuleManager;
import com.alibaba.csp.sentinel.slots.block.flow.param.ParamFlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.param.ParamFlowRuleManager;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 删除调用限流器实现
 * 基于 Sentinel，全局配额和单群组配额分别挂在两个资源上：
 * "{resource}:global" 上的 FlowRule 控制全局 QPS，"{resource}" 上的热点参数 ParamFlowRule 按 chatId 控制单群组配额
 *
 * 先检查全局资源，全局拒绝时不会消耗群组令牌
 */
@Slf4j
public class SentinelDeletionRateLimiter implements DeletionRateLimiter {

    public static final String DEFAULT_RESOURCE = "chatgc:delete-message";

    private static final String GLOBAL_SUFFIX = ":global";

    /**
     * 单群组配额资源名称（热点参数规则）
     */
    private final String resource;

    /**
     * 全局配额资源名称
     */
    private final String globalResource;

    public SentinelDeletionRateLimiter() {
        this(DEFAULT_RESOURCE);
    }

    public SentinelDeletionRateLimiter(String resource) {
        this.resource = resource;
        this.globalResource = resource + GLOBAL_SUFFIX;
    }

    @Override
    public boolean tryAcquire(long chatId) {
        Entry globalEntry = null;
        Entry chatEntry = null;

        try {
            globalEntry = SphU.entry(globalResource, EntryType.OUT);
            // 参数索引 0 为 chatId
            chatEntry = SphU.entry(resource, EntryType.OUT, 1, chatId);
            return true;

        } catch (BlockException e) {
            log.debug("删除调用被限流: resource={}, chatId={}, rule={}",
                    globalEntry == null ? globalResource : resource, chatId, e.getClass().getSimpleName());
            return false;

        } finally {
            // 按进入的相反顺序退出
            if (chatEntry != null) {
                chatEntry.exit(1, chatId);
            }
            if (globalEntry != null) {
                globalEntry.exit();
            }
        }
    }

    @Override
    public synchronized void updateRules(double globalQps, double perChatCount, int perChatWindowSeconds) {
        log.info("更新删除限流规则: resource={}, globalQps={}, perChatCount={}, perChatWindowSeconds={}",
                resource, globalQps, perChatCount, perChatWindowSeconds);

        FlowRule globalRule = new FlowRule(globalResource);
        globalRule.setGrade(RuleConstant.FLOW_GRADE_QPS);
        globalRule.setCount(globalQps);

        ParamFlowRule perChatRule = new ParamFlowRule(resource)
                .setParamIdx(0)  // chatId
                .setGrade(RuleConstant.FLOW_GRADE_QPS)
                .setCount(perChatCount)
                .setDurationInSec(perChatWindowSeconds);

        // 保留宿主应用中其他资源的规则
        List<FlowRule> flowRules = FlowRuleManager.getRules().stream()
                .filter(rule -> !resource.equals(rule.getResource()) && !globalResource.equals(rule.getResource()))
                .collect(Collectors.toCollection(ArrayList::new));
        flowRules.add(globalRule);
        FlowRuleManager.loadRules(flowRules);

        List<ParamFlowRule> paramRules = ParamFlowRuleManager.getRules().stream()
                .filter(rule -> !resource.equals(rule.getResource()))
                .collect(Collectors.toCollection(ArrayList::new));
        paramRules.add(perChatRule);
        ParamFlowRuleManager.loadRules(paramRules);
    }

    public String getResource() {
        return resource;
    }

    public String getGlobalResource() {
        return globalResource;
    }
}
