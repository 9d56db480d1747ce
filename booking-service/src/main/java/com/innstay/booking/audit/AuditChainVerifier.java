package com.innstay.booking.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditChainVerifier {

    private final AuditLogRepository auditLogRepository;

    @Transactional(readOnly = true)
    public ChainVerification verify(String entityType, String entityId) {
        List<AuditLogEntry> entries =
                auditLogRepository.findByEntityTypeAndEntityIdOrderByIdAsc(entityType, entityId);

        String expectedPrevious = AuditHashChain.GENESIS;
        for (AuditLogEntry entry : entries) {
            boolean linked = entry.getPreviousHash().equals(expectedPrevious);
            boolean untouched = constantTimeEquals(AuditHashChain.hashOf(entry), entry.getEntryHash());
            if (!linked || !untouched) {
                log.error("Audit chain broken: entity={}:{}, entryId={}", entityType, entityId, entry.getId());
                return ChainVerification.brokenAt(entries.size(), entry.getId());
            }
            expectedPrevious = entry.getEntryHash();
        }
        return ChainVerification.intact(entries.size());
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
