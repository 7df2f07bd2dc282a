package cn.bafuka.chatgc.exception;

/**
 * 存储不可用异常
 * 存储操作超时或失败时抛出，在存储访问层重试，不计入删除尝试次数
 *
 * @author ChatGC Team
 * @since 1.0
 */
public class StoreUnavailableException extends RuntimeException {

    /**
     * 失败的存储操作名称
     */
    private final String operation;

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return "StoreUnavailableException{" +
                "operation=" + operation +
                ", message=" + getMessage() +
                '}';
    }
}
