package com.checkmate.pos_sync.activity;

import com.checkmate.pos_sync.session.SessionInterceptor;
import com.checkmate.pos_sync.session.StationSession;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequiredArgsConstructor
public class AccountActivityController {

    private static final String DEFAULT_MEAL_TYPE = "L";

    private final AccountActivityService accountActivityService;

    /**
     * Defaults to today's lunch.
     */
    @GetMapping("/api/pos/accounts/{studentId}/records")
    public ResponseEntity<AccountActivity> records(
            @PathVariable("studentId") long studentId,
            @RequestParam(value = "lineDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate lineDate,
            @RequestParam(value = "mealType", required = false) String mealType,
            @RequestAttribute(SessionInterceptor.SESSION_ATTRIBUTE) StationSession session) {
        return ResponseEntity.ok(accountActivityService.activityFor(
                session,
                studentId,
                lineDate != null ? lineDate : LocalDate.now(),
                mealType != null && !mealType.isBlank() ? mealType : DEFAULT_MEAL_TYPE));
    }
}
