package com.microfinance.domain.service;

import com.microfinance.api.dto.DueCollectionItem;
import com.microfinance.domain.model.LoanStatus;
import com.microfinance.domain.model.Money;
import com.microfinance.domain.model.RepaymentSchedule;
import com.microfinance.domain.model.UserIdentity;
import com.microfinance.exception.LoanValidationException;
import com.microfinance.infrastructure.persistence.entity.LoanEntity;
import com.microfinance.infrastructure.persistence.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Installments of active loans falling due inside a date window, with arrears.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DueCollectionService {

    private final LoanRepository loanRepository;
    private final FeeScheduleCalculator calculator;
    private final LoanAccessPolicy accessPolicy;

    @Transactional(readOnly = true)
    public List<DueCollectionItem> dueCollections(LocalDate from, LocalDate to, String branchCode, UserIdentity user) {
        LocalDate start = from != null ? from : LocalDate.now();
        LocalDate end = to != null ? to : start;
        if (end.isBefore(start)) {
            throw new LoanValidationException("'to' must not be before 'from'");
        }

        List<DueCollectionItem> items = new ArrayList<>();
        for (LoanEntity loan : loanRepository.findByStatus(LoanStatus.ACTIVE)) {
            if (!accessPolicy.canAccess(user, loan)) {
                continue;
            }
            if (branchCode != null && !branchCode.isBlank() && !branchCode.equals(loan.getBranchCode())) {
                continue;
            }
            items.addAll(itemsFor(loan, start, end));
        }
        items.sort(Comparator.comparing(DueCollectionItem::getDueDate)
                .thenComparing(DueCollectionItem::getBranchCode, Comparator.nullsLast(Comparator.naturalOrder())));
        log.debug("Due collections {}..{}: {} installments", start, end, items.size());
        return items;
    }

    List<DueCollectionItem> itemsFor(LoanEntity loan, LocalDate from, LocalDate to) {
        RepaymentSchedule schedule = calculator.schedule(loan);
        List<LocalDate> dueDates = calculator.reportingDueDates(loan, schedule);
        BigDecimal realised = Money.round2(loan.getTotalRealization());

        List<DueCollectionItem> items = new ArrayList<>();
        for (int i = 0; i < dueDates.size(); i++) {
            LocalDate dueDate = dueDates.get(i);
            if (dueDate.isBefore(from) || dueDate.isAfter(to)) {
                continue;
            }
            BigDecimal expected = schedule.expectedThrough(i);
            items.add(DueCollectionItem.builder()
                    .loanId(loan.getId())
                    .category(loan.getCategory())
                    .branchName(loan.getBranchName())
                    .branchCode(loan.getBranchCode())
                    .loanOfficerName(loan.getLoanOfficerName())
                    .groupId(loan.getGroupId())
                    .clientId(loan.getClientId())
                    .currency(loan.getCurrency())
                    .dueDate(dueDate)
                    .periodIndex(i)
                    .periodCount(schedule.getPeriodCount())
                    .scheduledAmount(schedule.amountForPeriod(i))
                    .expectedToDate(expected)
                    .totalRealization(realised)
                    .arrears(Money.round2(expected.subtract(realised).max(BigDecimal.ZERO)))
                    .build());
        }
        return items;
    }
}
