package com.gt.vocab.review;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/review")
public class ReviewController {

    private final ReviewService reviewService;

    @Autowired
    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    public ReviewResult submitReview(@RequestBody ReviewRequest request) {
        return reviewService.submitReview(request);
    }
}
