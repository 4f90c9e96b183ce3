package com.example.emailscheduler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identity of this scheduler process, recorded on locks and executions.
 */
@Component
public class SchedulerInstance {

    private final String instanceId;

    public SchedulerInstance(@Value("${HOSTNAME:unknown}") String hostname) {
        this.instanceId = resolve(hostname);
    }

    public String getId() {
        return instanceId;
    }

    private static String resolve(String hostname) {
        try {
            var host = InetAddress.getLocalHost().getHostName();
            return host + "-" + ProcessHandle.current().pid();
        } catch (UnknownHostException e) {
            return hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
