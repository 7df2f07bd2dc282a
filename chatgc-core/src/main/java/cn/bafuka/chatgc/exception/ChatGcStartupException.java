package cn.bafuka.chatgc.exception;

/**
 * 启动失败异常
 * 恢复阶段无法读取存储时抛出，进程应拒绝启动
 */
public class ChatGcStartupException extends RuntimeException {

    public ChatGcStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
