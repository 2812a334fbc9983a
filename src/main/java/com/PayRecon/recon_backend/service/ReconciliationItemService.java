package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.dto.request.ItemStatusRequest;
import com.PayRecon.recon_backend.dto.response.PaginatedResponse;
import com.PayRecon.recon_backend.dto.response.ReconciliationItemResponse;
import com.PayRecon.recon_backend.enums.ExceptionStatus;
import com.PayRecon.recon_backend.enums.ReconType;
import com.PayRecon.recon_backend.enums.Severity;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.exception.ResourceNotFoundException;
import com.PayRecon.recon_backend.model.ReconciliationItem;
import com.PayRecon.recon_backend.repository.ReconciliationItemRepository;
import com.PayRecon.recon_backend.repository.ReconciliationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationItemService {

    private final ReconciliationItemRepository reconciliationItemRepository;
    private final ReconciliationRunRepository reconciliationRunRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public PaginatedResponse<ReconciliationItemResponse> getItems(UUID runId, Severity severity, ExceptionStatus status,
                                                                  ReconType reconType, int page, int limit) {
        if (!reconciliationRunRepository.existsById(runId)) {
            throw new ResourceNotFoundException("ReconciliationRun", "id", runId);
        }
        Pageable pageable = PageRequest.of(page - 1, limit,
                Sort.by("severity").and(Sort.by("reconType")).and(Sort.by("employeeId")));
        Page<ReconciliationItem> itemsPage =
                reconciliationItemRepository.findByCriteria(runId, severity, status, reconType, pageable);
        return PaginatedResponse.from(itemsPage, this::mapToItemResponse);
    }

    /**
     * Moves an exception through its review workflow. Resolved and accepted exceptions are final.
     */
    @Transactional
    public ReconciliationItemResponse updateStatus(UUID itemId, ItemStatusRequest request) {
        ReconciliationItem item = reconciliationItemRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("ReconciliationItem", "id", itemId));

        ExceptionStatus current = item.getStatus();
        ExceptionStatus target = request.getStatus();
        if (current.isTerminal()) {
            throw new ApiException("Exception is already " + current + " and cannot be changed",
                    HttpStatus.BAD_REQUEST, "INVALID_STATUS_TRANSITION");
        }
        if (!current.canTransitionTo(target)) {
            throw new ApiException("Cannot move exception from " + current + " to " + target,
                    HttpStatus.BAD_REQUEST, "INVALID_STATUS_TRANSITION");
        }

        item.setStatus(target);
        if (request.getNotes() != null) {
            item.setResolutionNotes(request.getNotes());
        }
        if (target.isTerminal()) {
            item.setResolvedBy(request.getResolvedBy());
            item.setResolvedAt(LocalDateTime.now());
        }

        ReconciliationItem savedItem = reconciliationItemRepository.save(item);
        log.info("Reconciliation exception {} moved from {} to {}", itemId, current, target);
        return mapToItemResponse(savedItem);
    }

    private ReconciliationItemResponse mapToItemResponse(ReconciliationItem item) {
        ReconciliationItemResponse response = modelMapper.map(item, ReconciliationItemResponse.class);
        response.setRunId(item.getRun().getId());
        return response;
    }
}
