package me.golemcore.reminder.adapter.inbound.web.controller;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.reminder.domain.model.Recurrence;
import me.golemcore.reminder.domain.model.Reminder;
import me.golemcore.reminder.domain.service.ReminderService;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Reminder endpoints for the dashboard UI.
 */
@RestController
@RequestMapping("/api/reminders")
@RequiredArgsConstructor
public class RemindersController {

    private final ReminderService reminderService;
    private final BotProperties properties;

    @GetMapping
    public Mono<ResponseEntity<List<ReminderDto>>> getUpcoming(@RequestParam(required = false) Integer limit) {
        BotProperties.ReminderProperties settings = properties.getReminders();
        int effectiveLimit = limit != null ? limit : settings.getDefaultListLimit();
        if (effectiveLimit < 1) {
            throw badRequest("limit must be >= 1");
        }
        effectiveLimit = Math.min(effectiveLimit, settings.getMaxListLimit());

        List<ReminderDto> reminders = reminderService.upcoming(effectiveLimit).stream()
                .map(RemindersController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(reminders));
    }

    @GetMapping("/due")
    public Mono<ResponseEntity<List<ReminderDto>>> getDue() {
        List<ReminderDto> reminders = reminderService.dueNow().stream()
                .map(RemindersController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(reminders));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ReminderDto>> getReminder(@PathVariable String id) {
        Reminder reminder = reminderService.find(id)
                .orElseThrow(() -> notFound(id));
        return Mono.just(ResponseEntity.ok(toDto(reminder)));
    }

    @PostMapping("/parse")
    public Mono<ResponseEntity<ReminderDto>> createFromText(@RequestBody ParseReminderRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            throw badRequest("text is required");
        }
        Reminder reminder = reminderService.addFromText(request.text())
                .orElseThrow(() -> badRequest("Could not find what to remind about in: " + request.text()));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(reminder)));
    }

    @PostMapping
    public Mono<ResponseEntity<ReminderDto>> create(@RequestBody CreateReminderRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        if (request.text() == null || request.text().isBlank()) {
            throw badRequest("text is required");
        }
        if (request.dueTime() == null) {
            throw badRequest("dueTime is required");
        }
        Recurrence recurrence = toRecurrence(request.recurrence());
        Reminder reminder = reminderService.addStructured(request.text(), request.dueTime(), recurrence);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(reminder)));
    }

    @PostMapping("/{id}/done")
    public Mono<ResponseEntity<ReminderDto>> markDone(@PathVariable String id) {
        if (!reminderService.markDone(id)) {
            throw notFound(id);
        }
        Reminder reminder = reminderService.find(id)
                .orElseThrow(() -> notFound(id));
        return Mono.just(ResponseEntity.ok(toDto(reminder)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<DeleteReminderResponse>> delete(@PathVariable String id) {
        if (!reminderService.cancel(id)) {
            throw notFound(id);
        }
        return Mono.just(ResponseEntity.ok(new DeleteReminderResponse(id)));
    }

    private static Recurrence toRecurrence(RecurrenceDto dto) {
        if (dto == null) {
            return null;
        }
        if (dto.count() == null) {
            throw badRequest("recurrence.count is required");
        }
        return new Recurrence(Recurrence.Unit.fromKey(dto.unit()), dto.count());
    }

    private static ReminderDto toDto(Reminder reminder) {
        Recurrence interval = reminder.getRecurringInterval();
        RecurrenceDto recurrence = interval != null
                ? new RecurrenceDto(interval.unit().key(), interval.count())
                : null;
        return new ReminderDto(
                reminder.getId(),
                reminder.getText(),
                reminder.getDueTime(),
                reminder.getCreatedAt(),
                reminder.isCompleted(),
                reminder.isRecurring(),
                recurrence,
                reminder.getLastTriggered());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Reminder not found: " + id);
    }

    public record ParseReminderRequest(String text) {
    }

    public record CreateReminderRequest(String text, Instant dueTime, RecurrenceDto recurrence) {
    }

    public record RecurrenceDto(String unit, Integer count) {
    }

    public record ReminderDto(
            String id,
            String text,
            Instant dueTime,
            Instant createdAt,
            boolean completed,
            boolean recurring,
            RecurrenceDto recurrence,
            Instant lastTriggered) {
    }

    public record DeleteReminderResponse(String id) {
    }
}
