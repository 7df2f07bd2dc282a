package cn.bafuka.chatgc.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ChatGC 示例应用启动类
 */
@SpringBootApplication
public class ChatGcExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatGcExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  ChatGC Example Application Started!");
        System.out.println("  Status: http://localhost:8080/api/diagnostic/health");
        System.out.println("========================================\n");
    }
}
