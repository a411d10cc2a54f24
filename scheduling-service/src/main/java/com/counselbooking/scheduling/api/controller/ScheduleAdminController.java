package com.counselbooking.scheduling.api.controller;

import com.counselbooking.common.dto.BaseResponse;
import com.counselbooking.scheduling.api.dto.AvailabilityWindowRequest;
import com.counselbooking.scheduling.api.dto.AvailabilityWindowResponse;
import com.counselbooking.scheduling.api.dto.BlockedSlotRequest;
import com.counselbooking.scheduling.api.dto.BlockedSlotResponse;
import com.counselbooking.scheduling.domain.model.AvailabilityWindow;
import com.counselbooking.scheduling.domain.model.BlockedSlot;
import com.counselbooking.scheduling.domain.service.ScheduleAdminService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class ScheduleAdminController {

    private final ScheduleAdminService scheduleAdminService;

    @GetMapping("/availability-windows")
    public ResponseEntity<BaseResponse<List<AvailabilityWindowResponse>>> listWindows() {
        List<AvailabilityWindowResponse> windows = scheduleAdminService.listWindows().stream()
                .map(AvailabilityWindowResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(windows));
    }

    @PostMapping("/availability-windows")
    public ResponseEntity<BaseResponse<AvailabilityWindowResponse>> createWindow(
            @Valid @RequestBody AvailabilityWindowRequest request) {
        AvailabilityWindow window = scheduleAdminService.createWindow(
                request.dayOfWeek(), request.startTime(), request.endTime(), request.active());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Availability window created", AvailabilityWindowResponse.from(window)));
    }

    @PutMapping("/availability-windows/{id}")
    public ResponseEntity<BaseResponse<AvailabilityWindowResponse>> updateWindow(
            @PathVariable Long id,
            @Valid @RequestBody AvailabilityWindowRequest request) {
        AvailabilityWindow window = scheduleAdminService.updateWindow(
                id, request.dayOfWeek(), request.startTime(), request.endTime(), request.active());
        return ResponseEntity.ok(BaseResponse.success(AvailabilityWindowResponse.from(window)));
    }

    @DeleteMapping("/availability-windows/{id}")
    public ResponseEntity<BaseResponse<AvailabilityWindowResponse>> deactivateWindow(@PathVariable Long id) {
        AvailabilityWindow window = scheduleAdminService.deactivateWindow(id);
        return ResponseEntity.ok(BaseResponse.success("Availability window deactivated", AvailabilityWindowResponse.from(window)));
    }

    @GetMapping("/blocked-slots")
    public ResponseEntity<BaseResponse<List<BlockedSlotResponse>>> listBlockedSlots(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from) {
        List<BlockedSlotResponse> blockedSlots = scheduleAdminService.listBlockedSlots(from).stream()
                .map(BlockedSlotResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(blockedSlots));
    }

    @PostMapping("/blocked-slots")
    public ResponseEntity<BaseResponse<BlockedSlotResponse>> createBlockedSlot(
            @Valid @RequestBody BlockedSlotRequest request) {
        BlockedSlot blockedSlot = scheduleAdminService.createBlockedSlot(
                request.dateTime(), request.duration(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Time slot blocked", BlockedSlotResponse.from(blockedSlot)));
    }

    @DeleteMapping("/blocked-slots/{id}")
    public ResponseEntity<BaseResponse<Void>> deleteBlockedSlot(@PathVariable Long id) {
        scheduleAdminService.deleteBlockedSlot(id);
        return ResponseEntity.ok(BaseResponse.success("Blocked slot removed", null));
    }
}
