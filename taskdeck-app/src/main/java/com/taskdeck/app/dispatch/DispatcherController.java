package com.taskdeck.app.dispatch;

import com.taskdeck.common.config.TaskdeckConfig;
import com.taskdeck.scheduler.poller.PollReport;
import com.taskdeck.scheduler.store.JobStoreException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * External trigger for one poll cycle, for cron services that call an URL.
 */
@Slf4j
@RestController
public class DispatcherController {

    private final DispatchService dispatchService;
    private final TaskdeckConfig config;

    public DispatcherController(DispatchService dispatchService, TaskdeckConfig config) {
        this.dispatchService = dispatchService;
        this.config = config;
    }

    @RequestMapping(value = "/api/cron/dispatcher", method = { RequestMethod.GET, RequestMethod.POST })
    public ResponseEntity<?> dispatch(HttpServletRequest request) {
        String secret = config.getScheduler().getCronSecret();
        if (secret != null && !secretMatches(secret, extractBearerToken(request))) {
            log.warn("Rejected dispatcher call from {}", request.getRemoteAddr());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Unauthorized"));
        }

        try {
            PollReport report = dispatchService.runCycle("http");
            return ResponseEntity.ok(report);
        } catch (JobStoreException e) {
            log.error("Dispatcher cycle failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    private static boolean secretMatches(String secret, String token) {
        if (token == null) {
            return false;
        }
        return MessageDigest.isEqual(secret.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8));
    }

    private static String extractBearerToken(HttpServletRequest request) {
        String auth = request.getHeader("Authorization");
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring(7).trim();
        }
        return null;
    }
}
