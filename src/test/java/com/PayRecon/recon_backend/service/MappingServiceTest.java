package com.PayRecon.recon_backend.service;

import com.PayRecon.recon_backend.config.ReconciliationProperties;
import com.PayRecon.recon_backend.dto.request.LocationMappingRequest;
import com.PayRecon.recon_backend.dto.request.SplitTargetsRequest;
import com.PayRecon.recon_backend.exception.ApiException;
import com.PayRecon.recon_backend.exception.ValidationException;
import com.PayRecon.recon_backend.model.CostCenterSplit;
import com.PayRecon.recon_backend.model.LocationMapping;
import com.PayRecon.recon_backend.repository.CostCenterSplitRepository;
import com.PayRecon.recon_backend.repository.JournalDescriptionMappingRepository;
import com.PayRecon.recon_backend.repository.LocationMappingRepository;
import com.PayRecon.recon_backend.repository.PayCompCodeMappingRepository;
import com.PayRecon.recon_backend.repository.TransactionTypeConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MappingService")
class MappingServiceTest {

    @Mock
    private LocationMappingRepository locationMappingRepository;

    @Mock
    private CostCenterSplitRepository costCenterSplitRepository;

    @Mock
    private JournalDescriptionMappingRepository journalDescriptionMappingRepository;

    @Mock
    private TransactionTypeConfigRepository transactionTypeConfigRepository;

    @Mock
    private PayCompCodeMappingRepository payCompCodeMappingRepository;

    @Mock
    private MappingRegistryService mappingRegistryService;

    private MappingService mappingService;

    @BeforeEach
    void setUp() {
        mappingService = new MappingService(
                locationMappingRepository,
                costCenterSplitRepository,
                journalDescriptionMappingRepository,
                transactionTypeConfigRepository,
                payCompCodeMappingRepository,
                mappingRegistryService,
                new SplitExpander(new ReconciliationProperties()));
    }

    @Nested
    @DisplayName("replaceSplitTargets")
    class ReplaceSplitTargets {

        @Test
        @DisplayName("Should replace every target of a split account")
        void shouldReplaceTargets() {
            // Given
            when(costCenterSplitRepository.deleteBySource("SPL-CHEF")).thenReturn(3);
            when(costCenterSplitRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
            SplitTargetsRequest request = new SplitTargetsRequest(List.of(
                    new SplitTargetsRequest.Target(" 458-50 ", new BigDecimal("0.6")),
                    new SplitTargetsRequest.Target("470-60", new BigDecimal("0.4"))), "Head chef");

            // When
            List<CostCenterSplit> splits = mappingService.replaceSplitTargets("SPL-CHEF", request);

            // Then
            assertThat(splits).extracting(CostCenterSplit::getTargetAccount).containsExactly("458-50", "470-60");
            assertThat(splits).allMatch(split -> "SPL-CHEF".equals(split.getSourceAccount())
                    && "Head chef".equals(split.getNotes()));
        }

        @Test
        @DisplayName("Should store partial redistribution weights as given")
        void shouldAcceptWeightsNotAddingUpToOne() {
            when(costCenterSplitRepository.deleteBySource("SPL-CHEF")).thenReturn(0);
            when(costCenterSplitRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
            SplitTargetsRequest request = new SplitTargetsRequest(List.of(
                    new SplitTargetsRequest.Target("458-50", new BigDecimal("0.6")),
                    new SplitTargetsRequest.Target("470-60", new BigDecimal("0.3"))), null);

            List<CostCenterSplit> splits = mappingService.replaceSplitTargets("SPL-CHEF", request);

            assertThat(splits).extracting(CostCenterSplit::getPercentage)
                    .containsExactly(new BigDecimal("0.6"), new BigDecimal("0.3"));
            verify(costCenterSplitRepository).deleteBySource("SPL-CHEF");
        }

        @Test
        @DisplayName("Should reject the same target listed twice")
        void shouldRejectDuplicateTargets() {
            SplitTargetsRequest request = new SplitTargetsRequest(List.of(
                    new SplitTargetsRequest.Target("458-50", new BigDecimal("0.5")),
                    new SplitTargetsRequest.Target("458-50", new BigDecimal("0.5"))), null);

            assertThatThrownBy(() -> mappingService.replaceSplitTargets("SPL-CHEF", request))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Duplicate split target");
        }

        @Test
        @DisplayName("Should refuse a real cost account as split source")
        void shouldRejectNonVirtualSource() {
            SplitTargetsRequest request = new SplitTargetsRequest(List.of(
                    new SplitTargetsRequest.Target("470-60", BigDecimal.ONE)), null);

            assertThatThrownBy(() -> mappingService.replaceSplitTargets("458-50", request))
                    .isInstanceOf(ApiException.class)
                    .extracting(e -> ((ApiException) e).getErrorCode())
                    .isEqualTo("INVALID_SPLIT_SOURCE");
            verifyNoInteractions(costCenterSplitRepository);
        }
    }

    @Nested
    @DisplayName("saveLocationMapping")
    class SaveLocationMapping {

        @Test
        @DisplayName("Should derive the department code from the cost account")
        void shouldDeriveDepartment() {
            when(locationMappingRepository.findByTimesheetLocation("Brisbane - Kitchen")).thenReturn(Optional.empty());
            when(locationMappingRepository.save(any(LocationMapping.class))).thenAnswer(invocation -> invocation.getArgument(0));
            LocationMappingRequest request = new LocationMappingRequest();
            request.setTimesheetLocation(" Brisbane - Kitchen ");
            request.setCostAccountCode("458-50");

            LocationMapping mapping = mappingService.saveLocationMapping(request);

            assertThat(mapping.getTimesheetLocation()).isEqualTo("Brisbane - Kitchen");
            assertThat(mapping.getCostAccountCode()).isEqualTo("458-50");
            assertThat(mapping.getDepartmentCode()).isEqualTo("50");
        }

        @Test
        @DisplayName("Should update an existing mapping in place")
        void shouldUpdateExisting() {
            LocationMapping existing = LocationMapping.builder()
                    .timesheetLocation("Brisbane - Kitchen")
                    .costAccountCode("458-50")
                    .departmentCode("50")
                    .build();
            when(locationMappingRepository.findByTimesheetLocation("Brisbane - Kitchen")).thenReturn(Optional.of(existing));
            when(locationMappingRepository.save(any(LocationMapping.class))).thenAnswer(invocation -> invocation.getArgument(0));
            LocationMappingRequest request = new LocationMappingRequest();
            request.setTimesheetLocation("Brisbane - Kitchen");
            request.setCostAccountCode("470-60");
            request.setActive(false);

            LocationMapping mapping = mappingService.saveLocationMapping(request);

            assertThat(mapping).isSameAs(existing);
            assertThat(mapping.getCostAccountCode()).isEqualTo("470-60");
            assertThat(mapping.getDepartmentCode()).isEqualTo("60");
            assertThat(mapping.isActive()).isFalse();
        }
    }
}
