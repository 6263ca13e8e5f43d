package com.ryuqq.enginebridge.core.hospice;

import com.ryuqq.enginebridge.core.model.HospiceStage;
import com.ryuqq.enginebridge.core.spi.NativeCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Native core 단계적 회수 코디네이터.
 *
 * <p><strong>프로토콜:</strong></p>
 * <pre>
 * 1. admit(environment, core) → 새 ID 발급, environment에 단발성 관찰자 설치
 * 2. environment 도달 불가 → ACTIVE → STAGE1
 * 3. collectorCycleCompleted() 마다 (순서대로):
 *    a. STAGE2: hold 없음 → core 해제 후 삭제 / hold 있음 → 경고, 유지
 *    b. 직전 통지에서 STAGED된 ID → STAGE2
 *    c. STAGE1: hold 없음 → STAGED / hold 있음 → 경고, 유지
 * </pre>
 *
 * <p>따라서 hold가 계속 없는 core는 environment가 도달 불가능해진 뒤 세 번째 통지에서
 * 해제됩니다. 통지 사이의 두 번의 재확인이 여러 번에 걸쳐 참조를 끊는 collector를 흡수합니다.</p>
 *
 * <p><strong>동시성:</strong> 등록, 단계 승격, 해제 기록은 하나의 lock으로 직렬화됩니다.
 * {@link NativeCore#free()}는 lock 밖에서 호출됩니다.</p>
 *
 * <p><strong>진단:</strong> {@link #anyAlive()}, {@link #freeze()}, {@link #unfreeze()}는
 * 테스트 하네스에서 teardown 완료를 확인하기 위한 것입니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class Hospice {

    private static final Logger log = LoggerFactory.getLogger(Hospice.class);

    private static final Object SHARED_LOCK = new Object();
    private static volatile Hospice shared;

    private final ReachabilityObserver observer;
    private final ReentrantLock lock = new ReentrantLock();

    private long nextId;
    private final Map<Long, Entry> entries = new HashMap<>();
    private final Set<Long> stage1 = new LinkedHashSet<>();
    private final Set<Long> staged = new LinkedHashSet<>();
    private final Set<Long> stage2 = new LinkedHashSet<>();
    private final Set<Long> frozen = new HashSet<>();
    private final Set<Long> deferred = new LinkedHashSet<>();
    private boolean paused;

    /**
     * 생성자.
     *
     * @param observer environment 도달 불가 감지기
     * @throws IllegalArgumentException observer가 null인 경우
     */
    public Hospice(ReachabilityObserver observer) {
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        this.observer = observer;
    }

    /**
     * 프로세스 공용 hospice.
     *
     * <p>{@link CleanerReachabilityObserver}와 {@link GcCycleNotifier}가 연결된 인스턴스를
     * 처음 호출 시 생성합니다.</p>
     *
     * @return 공용 인스턴스
     */
    public static Hospice shared() {
        Hospice instance = shared;
        if (instance == null) {
            synchronized (SHARED_LOCK) {
                instance = shared;
                if (instance == null) {
                    instance = new Hospice(new CleanerReachabilityObserver());
                    GcCycleNotifier.install(instance);
                    shared = instance;
                }
            }
        }
        return instance;
    }

    /**
     * Environment와 core 등록.
     *
     * <p>hospice는 environment를 강하게 참조하지 않으며, core는 해제될 때까지 강하게 참조합니다.</p>
     *
     * @param environment 관찰할 environment
     * @param core environment에 속한 core
     * @return 발급된 ID
     */
    public long admit(Object environment, NativeCore core) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (core == null) {
            throw new IllegalArgumentException("core cannot be null");
        }

        long id;
        lock.lock();
        try {
            id = nextId++;
            entries.put(id, new Entry(id, core));
        } finally {
            lock.unlock();
        }

        observer.watch(environment, () -> markUnreachable(id));
        log.info("Admitted environment {} and core {} with ID:{}", environment, core.id(), id);
        return id;
    }

    private void markUnreachable(long id) {
        lock.lock();
        try {
            Entry entry = entries.get(id);
            if (entry == null || entry.stage != HospiceStage.ACTIVE) {
                return;
            }
            if (paused) {
                deferred.add(id);
                log.debug("Environment died while frozen. Deferring ID:{}", id);
                return;
            }
            toStage1(entry);
        } finally {
            lock.unlock();
        }
        log.info("Environment has died. Keeping core for a few cycles. ID:{}", id);
    }

    private void toStage1(Entry entry) {
        entry.stage = HospiceStage.STAGE1;
        stage1.add(entry.id);
    }

    /**
     * Quiescence 통지 처리.
     *
     * <p>{@link #freeze()} 상태에서는 아무 단계도 진행하지 않습니다.</p>
     */
    public void collectorCycleCompleted() {
        List<Entry> garbage = new ArrayList<>();

        lock.lock();
        try {
            if (paused) {
                log.debug("Hospice is frozen; skipping cycle");
                return;
            }

            for (Iterator<Long> it = stage2.iterator(); it.hasNext(); ) {
                Entry entry = entries.get(it.next());
                if (entry.isHeld()) {
                    log.warn("Core is still in use in stage 2. ID:{} ({} holds)", entry.id, entry.core.outstandingHolds());
                    continue;
                }
                it.remove();
                entries.remove(entry.id);
                entry.stage = HospiceStage.RELEASED;
                garbage.add(entry);
            }

            for (Long id : staged) {
                entries.get(id).stage = HospiceStage.STAGE2;
                stage2.add(id);
            }
            staged.clear();

            for (Iterator<Long> it = stage1.iterator(); it.hasNext(); ) {
                Entry entry = entries.get(it.next());
                if (entry.isHeld()) {
                    log.warn("Core is still in use. ID:{} ({} holds)", entry.id, entry.core.outstandingHolds());
                    continue;
                }
                it.remove();
                entry.stage = HospiceStage.STAGED;
                staged.add(entry.id);
            }
        } finally {
            lock.unlock();
        }

        for (Entry entry : garbage) {
            try {
                entry.core.free();
                log.info("Released core {} ID:{}", entry.core.id(), entry.id);
            } catch (RuntimeException e) {
                log.error("Failed to release core {} ID:{}", entry.core.id(), entry.id, e);
            }
        }
    }

    /**
     * 해제되지 않은 항목이 있는지 확인.
     *
     * <p>{@link #freeze()} 시점에 등록되어 있던 항목은 {@link #unfreeze()} 전까지 제외됩니다.</p>
     *
     * @return 남은 항목이 있으면 true
     */
    public boolean anyAlive() {
        lock.lock();
        try {
            for (Long id : entries.keySet()) {
                if (!frozen.contains(id)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 단계 진행을 멈추고 현재 항목을 진단 대상에서 제외.
     *
     * <p>멈춘 동안의 도달 불가 통지는 {@link #unfreeze()}까지 보류되며, 해당 항목은 ACTIVE로 남습니다.</p>
     */
    public void freeze() {
        lock.lock();
        try {
            paused = true;
            frozen.addAll(entries.keySet());
        } finally {
            lock.unlock();
        }
        log.debug("Hospice frozen");
    }

    /**
     * 단계 진행 재개.
     *
     * <p>freeze 중에 도달 불가로 통지된 항목은 이때 STAGE1로 들어갑니다.</p>
     */
    public void unfreeze() {
        int released;
        lock.lock();
        try {
            paused = false;
            frozen.clear();
            released = deferred.size();
            for (Long id : deferred) {
                toStage1(entries.get(id));
            }
            deferred.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Hospice unfrozen ({} deferred environments moved to stage 1)", released);
    }

    /**
     * 항목의 현재 단계.
     *
     * @param id admit()이 반환한 ID
     * @return 현재 단계 (이미 해제되었으면 RELEASED)
     * @throws IllegalArgumentException 발급된 적 없는 ID인 경우
     */
    public HospiceStage stageOf(long id) {
        lock.lock();
        try {
            Entry entry = entries.get(id);
            if (entry != null) {
                return entry.stage;
            }
            if (id >= 0 && id < nextId) {
                return HospiceStage.RELEASED;
            }
            throw new IllegalArgumentException("Unknown hospice ID: " + id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 해제되지 않은 항목 수
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class Entry {

        private final long id;
        private final NativeCore core;
        private HospiceStage stage = HospiceStage.ACTIVE;

        private Entry(long id, NativeCore core) {
            this.id = id;
            this.core = core;
        }

        private boolean isHeld() {
            return core.outstandingHolds() > 0;
        }
    }
}
