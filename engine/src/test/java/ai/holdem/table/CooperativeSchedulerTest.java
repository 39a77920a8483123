package ai.holdem.table;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class CooperativeSchedulerTest {

    @Test
    void runsInDueOrderThenSchedulingOrder() {
        CooperativeScheduler scheduler = new CooperativeScheduler();
        List<String> ran = new ArrayList<>();
        scheduler.schedule(100, () -> true, () -> ran.add("b"));
        scheduler.schedule(50, () -> true, () -> ran.add("a"));
        scheduler.schedule(100, () -> true, () -> ran.add("c"));

        assertEquals(3, scheduler.runAll());
        assertEquals(List.of("a", "b", "c"), ran);
        assertEquals(100, scheduler.now());
    }

    @Test
    void guardIsCheckedWhenTheTaskComesDue() {
        CooperativeScheduler scheduler = new CooperativeScheduler();
        AtomicBoolean stillValid = new AtomicBoolean(true);
        List<String> ran = new ArrayList<>();
        scheduler.schedule(10, stillValid::get, () -> ran.add("stale"));
        stillValid.set(false);

        assertTrue(scheduler.runNext());
        assertTrue(ran.isEmpty());
        assertFalse(scheduler.runNext());
    }

    @Test
    void tasksMayScheduleFollowUps() {
        CooperativeScheduler scheduler = new CooperativeScheduler();
        List<Long> times = new ArrayList<>();
        Runnable[] step = new Runnable[1];
        step[0] = () -> {
            times.add(scheduler.now());
            if (times.size() < 3) {
                scheduler.schedule(200, () -> true, step[0]);
            }
        };
        scheduler.schedule(200, () -> true, step[0]);

        assertEquals(3, scheduler.runAll());
        assertEquals(List.of(200L, 400L, 600L), times);
        assertEquals(0, scheduler.pending());
    }

    @Test
    void pacerIsAskedToWaitOutTheGap() {
        List<Long> pauses = new ArrayList<>();
        CooperativeScheduler scheduler = new CooperativeScheduler(pauses::add);
        scheduler.schedule(600, () -> true, () -> { });
        scheduler.schedule(600, () -> true, () -> { });
        scheduler.schedule(1200, () -> true, () -> { });
        scheduler.runAll();
        assertEquals(List.of(600L, 600L), pauses);
    }

    @Test
    void clearDropsEverything() {
        CooperativeScheduler scheduler = new CooperativeScheduler();
        scheduler.schedule(1, () -> true, () -> fail("cleared task ran"));
        assertEquals(1, scheduler.pending());
        scheduler.clear();
        assertEquals(0, scheduler.runAll());
    }
}
