package com.budgetbuckets.ledger.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.budgetbuckets.ledger.error.ResourceNotFoundException;
import com.budgetbuckets.ledger.repository.BucketRepository;
import com.budgetbuckets.ledger.repository.ExpenseRepository;
import com.budgetbuckets.ledger.repository.IncomeRepository;
import com.budgetbuckets.ledger.repository.RolloverHistoryRepository;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserDataResetServiceTest {

    @Mock
    private UserService userService;
    @Mock
    private ExpenseRepository expenseRepository;
    @Mock
    private BucketRepository bucketRepository;
    @Mock
    private IncomeRepository incomeRepository;
    @Mock
    private RolloverHistoryRepository rolloverHistoryRepository;

    private UserDataResetService service;

    @BeforeEach
    void setUp() {
        service = new UserDataResetService(userService, expenseRepository, bucketRepository, incomeRepository,
                rolloverHistoryRepository);
    }

    @Test
    void deletesExpensesBeforeBucketsAndReportsCounts() {
        UUID userId = UUID.randomUUID();
        when(expenseRepository.deleteByUserId(userId)).thenReturn(12);
        when(rolloverHistoryRepository.deleteByUserId(userId)).thenReturn(6);
        when(bucketRepository.deleteByUserId(userId)).thenReturn(3);
        when(incomeRepository.deleteByUserId(userId)).thenReturn(2);

        UserDataResetService.ResetSummary summary = service.deleteAllUserData(userId);

        assertThat(summary.bucketsDeleted()).isEqualTo(3);
        assertThat(summary.incomesDeleted()).isEqualTo(2);
        assertThat(summary.expensesDeleted()).isEqualTo(12);
        assertThat(summary.rolloverEntriesDeleted()).isEqualTo(6);
        InOrder order = inOrder(expenseRepository, bucketRepository);
        order.verify(expenseRepository).deleteByUserId(userId);
        order.verify(bucketRepository).deleteByUserId(userId);
    }

    @Test
    void unknownUserDeletesNothing() {
        UUID userId = UUID.randomUUID();
        doThrow(new ResourceNotFoundException("User", userId)).when(userService).requireUser(userId);

        assertThatThrownBy(() -> service.deleteAllUserData(userId))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(expenseRepository, bucketRepository, incomeRepository, rolloverHistoryRepository);
    }
}
