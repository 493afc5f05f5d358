package com.example.cruisesync.api.controller;

import com.example.cruisesync.api.response.ApiResponse;
import com.example.cruisesync.api.response.BreakerStatusResponse;
import com.example.cruisesync.api.response.LockStatusResponse;
import com.example.cruisesync.domain.model.CruiseLineLock;
import com.example.cruisesync.infrastructure.ftp.CircuitBreaker;
import com.example.cruisesync.infrastructure.ftp.CircuitBreakerRegistry;
import com.example.cruisesync.infrastructure.lock.CruiseLineLockStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final CruiseLineLockStore lockStore;

    public AdminController(CircuitBreakerRegistry circuitBreakerRegistry, CruiseLineLockStore lockStore) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.lockStore = lockStore;
    }

    @GetMapping("/remote/breakers")
    public ApiResponse<List<BreakerStatusResponse>> breakers() {
        List<BreakerStatusResponse> result = new ArrayList<>();
        for (CircuitBreaker breaker : circuitBreakerRegistry.all().values()) {
            result.add(new BreakerStatusResponse(
                    breaker.name(),
                    breaker.state().name(),
                    breaker.recentFailureCount(),
                    breaker.remainingCoolDown().toMillis(),
                    breaker.totalOpenings()));
        }
        return ApiResponse.success(result);
    }

    @PostMapping("/remote/breakers/{host}/reset")
    public ApiResponse<String> resetBreaker(@PathVariable("host") String host) {
        if (!circuitBreakerRegistry.reset(host)) {
            return ApiResponse.notFound("No breaker for host " + host);
        }
        log.info("ADMIN_BREAKER_RESET host={}", host);
        return ApiResponse.success("CLOSED");
    }

    @GetMapping("/locks/{lineId}")
    public ApiResponse<LockStatusResponse> lock(@PathVariable("lineId") int lineId) {
        Optional<CruiseLineLock> lock = lockStore.current(lineId);
        if (!lock.isPresent()) {
            return ApiResponse.success(new LockStatusResponse(lineId, false, null, null, null));
        }
        CruiseLineLock held = lock.get();
        return ApiResponse.success(new LockStatusResponse(lineId, true, held.getHolderId(),
                held.getAcquiredAt(), held.getExpiresAt()));
    }
}
