package com.phillippitts.mockinterview.service.integrity;

import com.phillippitts.mockinterview.domain.Violation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Buffers integrity signals posted by the candidate's client until the monitor next polls.
 */
@Component
public class ReportedSignalViolationSource implements ViolationSource {

    private final Map<UUID, Queue<Violation>> pending = new ConcurrentHashMap<>();

    public void submit(UUID handle, Violation violation) {
        pending.computeIfAbsent(handle, h -> new ConcurrentLinkedQueue<>()).add(violation);
    }

    @Override
    public List<Violation> poll(UUID handle) {
        Queue<Violation> queue = pending.get(handle);
        if (queue == null) {
            return List.of();
        }
        List<Violation> drained = new ArrayList<>();
        Violation v;
        while ((v = queue.poll()) != null) {
            drained.add(v);
        }
        return drained;
    }

    public void forget(UUID handle) {
        pending.remove(handle);
    }
}
