package com.autonomous.supervisor;

import com.autonomous.supervisor.service.FileSendToolServer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication
public class SupervisorApplication {

    public static void main(String[] args) throws Exception {
        if (args.length > 0 && FileSendToolServer.COMMAND.equals(args[0])) {
            FileSendToolServer.main(Arrays.copyOfRange(args, 1, args.length));
            return;
        }
        SpringApplication.run(SupervisorApplication.class, args);
    }
}
