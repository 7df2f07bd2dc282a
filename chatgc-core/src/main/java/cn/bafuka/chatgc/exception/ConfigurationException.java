package cn.bafuka.chatgc.exception;

/**
 * 配置错误（TTL 非法等），在 schedule 调用边界直接拒绝
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
