package com.example.emailscheduler.service.executor;

import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.repository.ProcessingScheduleRepository;
import com.example.emailscheduler.exception.ScheduleNotFoundException;
import com.example.emailscheduler.service.recurrence.NextRunCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Moves a schedule past the instant it just ran for.
 * <p>
 * After a success, one-shot schedules are disabled and all others get their
 * next due instant recomputed. After a failure the due instant is kept so the
 * next poll retries it, until the attempts for that instant are used up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleAdvancer {

    private final ProcessingScheduleRepository scheduleRepository;
    private final NextRunCalculator nextRunCalculator;

    @Transactional
    public ProcessingSchedule recordSuccess(UUID scheduleId, Instant now) {
        var schedule = getSchedule(scheduleId);
        schedule.recordSuccess(now);
        advance(schedule, now);
        return scheduleRepository.save(schedule);
    }

    @Transactional
    public ProcessingSchedule recordFailure(UUID scheduleId, int attemptNumber, int maxAttempts, Instant now) {
        var schedule = getSchedule(scheduleId);
        schedule.recordFailure();

        if (attemptNumber >= maxAttempts) {
            log.warn("Schedule {} failed {} of {} attempts for {}, moving on",
                    scheduleId, attemptNumber, maxAttempts, schedule.getNextExecutionAt());
            advance(schedule, now);
        } else {
            log.info("Schedule {} failed attempt {} of {}, retrying on next poll", scheduleId, attemptNumber, maxAttempts);
        }
        return scheduleRepository.save(schedule);
    }

    private void advance(ProcessingSchedule schedule, Instant now) {
        if (schedule.getType().isOneShot()) {
            schedule.setEnabled(false);
            schedule.setNextExecutionAt(null);
            log.info("One-shot schedule {} disabled after its run", schedule.getId());
            return;
        }

        var next = nextRunCalculator.calculateNextExecution(schedule.toDefinition(), now).orElse(null);
        schedule.setNextExecutionAt(next);
        if (next == null) {
            log.info("Schedule {} has no further occurrences and is now dormant", schedule.getId());
        } else {
            log.debug("Schedule {} next due at {}", schedule.getId(), next);
        }
    }

    private ProcessingSchedule getSchedule(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }
}
