package com.rescuegrid.notification.service;

import com.rescuegrid.common.exception.BusinessException;
import com.rescuegrid.common.exception.DataAccessErrors;
import com.rescuegrid.common.exception.ErrorCode;
import com.rescuegrid.notification.dto.NotificationDraft;
import com.rescuegrid.notification.entity.Notification;
import com.rescuegrid.notification.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 알림 저장/조회 서비스.
 *
 * <h3>중복 방지</h3>
 * <pre>
 *   createNotification(draft)
 *     ├─ dedupKey 있음 + 이미 저장됨 → Optional.empty() (재전달된 이벤트)
 *     └─ 그 외                      → INSERT
 * </pre>
 * <p>두 소비자가 같은 키를 동시에 넣으면 unique 제약 위반이 DATABASE_ERROR로 올라가고,
 * 메시지가 재전달되면 위의 존재 확인에서 걸러진다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NotificationService {

    private final NotificationRepository notificationRepository;

    /**
     * 알림 생성.
     *
     * @return 저장된 알림. 같은 dedupKey가 이미 있으면 empty
     * @throws BusinessException INVALID_INPUT - 제목/본문/수신자 누락, reference 짝 불일치, 빈 메타데이터 키
     */
    @Transactional
    public Optional<Notification> createNotification(NotificationDraft draft) {
        validate(draft);
        try {
            if (draft.dedupKey() != null && notificationRepository.existsByDedupKey(draft.dedupKey())) {
                log.info("Notification already exists for {}, skipping", draft.dedupKey());
                return Optional.empty();
            }

            Notification notification = Notification.builder()
                    .title(draft.title().trim())
                    .message(draft.message().trim())
                    .category(draft.category())
                    .type(draft.type())
                    .severity(draft.severity())
                    .recipientType(draft.recipientType())
                    .recipientId(draft.recipientId())
                    .referenceType(draft.referenceType())
                    .referenceId(draft.referenceId())
                    .metadata(draft.metadata())
                    .dedupKey(draft.dedupKey())
                    .build();
            notificationRepository.saveAndFlush(notification);

            log.info("Notification created: id={}, type={}/{}, recipient={}:{}",
                    notification.getId(), draft.category(), draft.type(), draft.recipientType(), draft.recipientId());
            return Optional.of(notification);
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    public Notification getNotification(UUID notificationId) {
        return notificationRepository.findById(notificationId)
                .orElseThrow(() -> new BusinessException(ErrorCode.NOTIFICATION_NOT_FOUND));
    }

    /** 최신순. recipientId가 null이면 전체 */
    public List<Notification> getNotifications(String recipientId, boolean unreadOnly) {
        if (recipientId == null) {
            return notificationRepository.findAllByOrderByCreatedAtDesc();
        }
        return unreadOnly
                ? notificationRepository.findByRecipientIdAndReadFalseOrderByCreatedAtDesc(recipientId)
                : notificationRepository.findByRecipientIdOrderByCreatedAtDesc(recipientId);
    }

    public long countUnread(String recipientId) {
        return notificationRepository.countByRecipientIdAndReadFalse(recipientId);
    }

    @Transactional
    public Notification markAsRead(UUID notificationId) {
        Notification notification = getNotification(notificationId);
        notification.markAsRead();
        return notification;
    }

    /** @return 읽음 처리된 건수 */
    @Transactional
    public int markAllAsRead(String recipientId) {
        try {
            int updated = notificationRepository.markAllAsRead(recipientId, LocalDateTime.now());
            log.info("Marked {} notification(s) as read for {}", updated, recipientId);
            return updated;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
    }

    @Transactional
    public void deleteNotification(UUID notificationId) {
        Notification notification = getNotification(notificationId);
        try {
            notificationRepository.delete(notification);
            notificationRepository.flush();
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e);
        }
        log.info("Notification deleted: id={}", notificationId);
    }

    private static void validate(NotificationDraft draft) {
        if (isBlank(draft.title()) || isBlank(draft.message())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Title and message are required");
        }
        if (isBlank(draft.category()) || isBlank(draft.type())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Category and type are required");
        }
        if (isBlank(draft.recipientType()) || isBlank(draft.recipientId())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Recipient is required");
        }
        if (isBlank(draft.referenceType()) != isBlank(draft.referenceId())) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "ReferenceType and ReferenceId must be provided together (both or none)");
        }
        if (draft.metadata() != null) {
            for (Map.Entry<String, String> entry : draft.metadata().entrySet()) {
                if (isBlank(entry.getKey()) || entry.getValue() == null) {
                    throw new BusinessException(ErrorCode.INVALID_INPUT,
                            "Metadata keys must not be empty and values must not be null");
                }
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
