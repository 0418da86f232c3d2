package com.vpnshop.fulfillment.api;

import com.vpnshop.fulfillment.core.ManualReviewQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator view of payments and failures that need a human.
 */
@RestController
@RequestMapping("/api/v1/reviews")
@RequiredArgsConstructor
@Tag(name = "Manual review", description = "Orphaned, mismatched, late and conflicting payments; failed provisioning and revokes")
public class ReviewController {

    private final ManualReviewQueue reviewQueue;

    @GetMapping
    @Operation(summary = "List open review items", description = "Oldest first.")
    public ResponseEntity<Page<ReviewItemDto>> listOpen(@RequestParam(name = "page", defaultValue = "0") int page,
                                                        @RequestParam(name = "size", defaultValue = "50") int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 200));
        return ResponseEntity.ok(reviewQueue.listOpen(pageable).map(ReviewItemDto::from));
    }

    @PostMapping("/{reviewId}/resolve")
    @Operation(summary = "Resolve review item")
    public ResponseEntity<ReviewItemDto> resolve(@PathVariable("reviewId") String reviewId,
                                                 @RequestBody(required = false) RefundRequestDto dto) {
        String note = dto != null ? dto.getNote() : null;
        return ResponseEntity.ok(ReviewItemDto.from(reviewQueue.resolve(reviewId, note)));
    }
}
