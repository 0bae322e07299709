package com.rescuegrid.dispatch.service;

import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.dispatch.entity.AssignmentStatus;
import com.rescuegrid.dispatch.entity.DispatchAssignment;
import com.rescuegrid.dispatch.entity.DispatchOrder;
import com.rescuegrid.dispatch.entity.DispatchStatus;
import com.rescuegrid.dispatch.entity.Unit;
import com.rescuegrid.dispatch.entity.UnitStatus;
import com.rescuegrid.dispatch.entity.UnitType;
import com.rescuegrid.dispatch.repository.DispatchAssignmentRepository;
import com.rescuegrid.dispatch.repository.DispatchOrderRepository;
import com.rescuegrid.dispatch.repository.UnitRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ★ 실제 트랜잭션/행 락으로 검증하는 라이프사이클 테스트 (H2).
 *
 * 테스트 메서드 트랜잭션을 끄고(NOT_SUPPORTED) 서비스 호출마다 커밋되게 한다.
 * 그래야 두 스레드가 서로의 커밋 결과와 유닛 행 락을 실제로 경합한다.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(DispatchService.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class DispatchServiceIntegrationTest {

    @Autowired
    private DispatchService dispatchService;
    @Autowired
    private UnitRepository unitRepository;
    @Autowired
    private DispatchOrderRepository dispatchOrderRepository;
    @Autowired
    private DispatchAssignmentRepository assignmentRepository;

    @AfterEach
    void tearDown() {
        assignmentRepository.deleteAll();
        dispatchOrderRepository.deleteAll();
        unitRepository.deleteAll();
    }

    @Test
    @DisplayName("같은 유닛을 서로 다른 지령에 동시에 배정하면 정확히 1건만 성공하고 나머지는 UNIT_BUSY")
    void concurrentAssignment_SameUnit_ExactlyOneWins() throws Exception {
        // Given
        Unit unit = unitRepository.save(Unit.builder().code("AMB-01").type(UnitType.AMBULANCE).build());
        UUID firstOrder = dispatchService.createOrder(UUID.randomUUID(), List.of()).getId();
        UUID secondOrder = dispatchService.createOrder(UUID.randomUUID(), List.of()).getId();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<UUID>> futures = new ArrayList<>();
        for (UUID orderId : List.of(firstOrder, secondOrder)) {
            Callable<UUID> task = () -> {
                ready.countDown();
                start.await();
                return dispatchService.createAssignment(orderId, unit.getId()).getId();
            };
            futures.add(executor.submit(task));
        }

        // When
        ready.await(5, TimeUnit.SECONDS);
        start.countDown();

        int succeeded = 0;
        List<Throwable> failures = new ArrayList<>();
        for (Future<UUID> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                succeeded++;
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }
        executor.shutdown();

        // Then
        assertThat(succeeded).isEqualTo(1);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).isInstanceOf(BusinessException.class);
        assertThat(((BusinessException) failures.get(0)).getErrorCode()).isEqualTo(ErrorCode.UNIT_BUSY);

        assertThat(assignmentRepository.existsActiveByUnitId(unit.getId())).isTrue();
        assertThat(assignmentRepository.findAll()).hasSize(1);
        assertThat(unitRepository.findById(unit.getId()).orElseThrow().getStatus()).isEqualTo(UnitStatus.ASSIGNED);
    }

    @Test
    @DisplayName("같은 지령의 두 배정을 동시에 COMPLETED로 바꾸면 지령도 COMPLETED가 된다")
    void concurrentCompletion_SameOrder_OrderCompletes() throws Exception {
        // Given
        Unit first = unitRepository.save(Unit.builder().code("AMB-01").type(UnitType.AMBULANCE).build());
        Unit second = unitRepository.save(Unit.builder().code("FIRE-01").type(UnitType.FIRE_TRUCK).build());
        DispatchOrder order = dispatchService.createOrder(UUID.randomUUID(), List.of());
        List<UUID> assignmentIds = new ArrayList<>();
        for (Unit unit : List.of(first, second)) {
            UUID assignmentId = dispatchService.createAssignment(order.getId(), unit.getId()).getId();
            dispatchService.transitionAssignment(assignmentId, AssignmentStatus.EN_ROUTE);
            dispatchService.transitionAssignment(assignmentId, AssignmentStatus.ON_SITE);
            assignmentIds.add(assignmentId);
        }

        // When
        List<Throwable> failures = runConcurrently(assignmentIds.stream()
                .<Callable<Object>>map(id -> () -> dispatchService.transitionAssignment(id, AssignmentStatus.COMPLETED))
                .toList());

        // Then
        assertThat(failures).isEmpty();
        DispatchOrder completed = dispatchService.getOrder(order.getId());
        assertThat(completed.getStatus()).isEqualTo(DispatchStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(assignmentIds).allSatisfy(id ->
                assertThat(dispatchService.getAssignment(id).getStatus()).isEqualTo(AssignmentStatus.COMPLETED));
        assertThat(unitRepository.findAll()).allSatisfy(unit ->
                assertThat(unit.getStatus()).isEqualTo(UnitStatus.AVAILABLE));
    }

    @Test
    @DisplayName("CREATED 지령에 서로 다른 유닛을 동시에 배정하면 둘 다 성공한다")
    void concurrentAssignment_DifferentUnits_BothSucceed() throws Exception {
        // Given
        Unit first = unitRepository.save(Unit.builder().code("AMB-01").type(UnitType.AMBULANCE).build());
        Unit second = unitRepository.save(Unit.builder().code("AMB-02").type(UnitType.AMBULANCE).build());
        DispatchOrder order = dispatchService.createOrder(UUID.randomUUID(), List.of());

        // When
        List<Throwable> failures = runConcurrently(List.of(
                () -> dispatchService.createAssignment(order.getId(), first.getId()),
                () -> dispatchService.createAssignment(order.getId(), second.getId())));

        // Then
        assertThat(failures).isEmpty();
        assertThat(dispatchService.getAssignments(order.getId())).hasSize(2);
        assertThat(dispatchService.getOrder(order.getId()).getStatus()).isEqualTo(DispatchStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("시나리오: 배정 → 다른 지령 배정 UNIT_BUSY → ON_SITE 건너뛰기 거절 → 순서대로 완료")
    void lifecycleScenario() {
        // Given
        Unit unit = unitRepository.save(Unit.builder().code("AMB-01").type(UnitType.AMBULANCE).build());
        DispatchOrder order = dispatchService.createOrder(UUID.randomUUID(), List.of("Caller reports smoke"));
        DispatchOrder otherOrder = dispatchService.createOrder(UUID.randomUUID(), List.of());

        // When: 첫 배정
        DispatchAssignment assignment = dispatchService.createAssignment(order.getId(), unit.getId());

        // Then
        assertThat(dispatchService.getOrder(order.getId()).getStatus()).isEqualTo(DispatchStatus.IN_PROGRESS);
        assertThat(unitRepository.findById(unit.getId()).orElseThrow().getStatus()).isEqualTo(UnitStatus.ASSIGNED);

        // 다른 지령에 같은 유닛
        assertThatThrownBy(() -> dispatchService.createAssignment(otherOrder.getId(), unit.getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.UNIT_BUSY));

        // 같은 지령에 같은 유닛
        assertThatThrownBy(() -> dispatchService.createAssignment(order.getId(), unit.getId()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DUPLICATE_ASSIGNMENT));

        // ASSIGNED → ON_SITE
        assertThatThrownBy(() -> dispatchService.transitionAssignment(assignment.getId(), AssignmentStatus.ON_SITE))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_ASSIGNMENT_TRANSITION));

        dispatchService.transitionAssignment(assignment.getId(), AssignmentStatus.EN_ROUTE);
        dispatchService.transitionAssignment(assignment.getId(), AssignmentStatus.ON_SITE);
        dispatchService.transitionAssignment(assignment.getId(), AssignmentStatus.COMPLETED);

        DispatchOrder completed = dispatchService.getOrder(order.getId());
        assertThat(completed.getStatus()).isEqualTo(DispatchStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(completed.getNotes()).containsExactly("Caller reports smoke");
        assertThat(unitRepository.findById(unit.getId()).orElseThrow().getStatus()).isEqualTo(UnitStatus.AVAILABLE);
        assertThat(dispatchService.getAssignment(assignment.getId()).getStatus()).isEqualTo(AssignmentStatus.COMPLETED);

        // 완료 후에는 유닛을 다른 지령에 다시 배정할 수 있다
        DispatchAssignment next = dispatchService.createAssignment(otherOrder.getId(), unit.getId());
        assertThat(next.getStatus()).isEqualTo(AssignmentStatus.ASSIGNED);
    }

    /** 작업들을 동시에 출발시키고 실패 원인만 모아 돌려준다 */
    private static List<Throwable> runConcurrently(List<Callable<Object>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch ready = new CountDownLatch(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> futures = new ArrayList<>();
        for (Callable<Object> task : tasks) {
            futures.add(executor.submit(() -> {
                ready.countDown();
                start.await();
                return task.call();
            }));
        }
        ready.await(5, TimeUnit.SECONDS);
        start.countDown();

        List<Throwable> failures = new ArrayList<>();
        for (Future<Object> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }
        executor.shutdown();
        return failures;
    }

    @Test
    @DisplayName("메모는 JSON 컬럼에 순서대로 누적된다")
    void appendOrderNotes_PersistsInOrder() {
        // Given
        DispatchOrder order = dispatchService.createOrder(UUID.randomUUID(), List.of("first"));

        // When
        dispatchService.appendOrderNotes(order.getId(), List.of("second"));
        dispatchService.appendOrderNotes(order.getId(), List.of("third", " "));

        // Then
        assertThat(dispatchOrderRepository.findById(order.getId()).orElseThrow().getNotes())
                .containsExactly("first", "second", "third");
    }

    @Test
    @DisplayName("사건당 지령은 1개 - 두 번째 생성은 DUPLICATE_DISPATCH_ORDER")
    void createOrder_SameIncidentTwice_Duplicate() {
        // Given
        UUID incidentId = UUID.randomUUID();
        dispatchService.createOrder(incidentId, List.of());

        // When & Then
        assertThatThrownBy(() -> dispatchService.createOrder(incidentId, List.of()))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DUPLICATE_DISPATCH_ORDER));
        assertThat(dispatchService.getOrderByIncident(incidentId)).isNotNull();
    }
}
