package com.typehub.raceservice.race.interfaces.http;

import com.typehub.metrics.learning.AdaptiveLearningEngine.Lesson;
import com.typehub.metrics.learning.CharacterConfidence;
import com.typehub.raceservice.race.service.LearningService;
import com.typehub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 逐字母练习 http 接口
 */
@RestController
@RequestMapping("/api/learning/users/{userId}")
@RequiredArgsConstructor
public class LearningController {

    private final LearningService learningService;

    @GetMapping("/letters")
    public ResponseEntity<ApiResponse<List<CharacterConfidence>>> letters(@PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(learningService.letterStats(userId)));
    }

    @GetMapping("/lesson")
    public ResponseEntity<ApiResponse<Lesson>> lesson(@PathVariable String userId,
                                                      @RequestParam(defaultValue = "30") int words) {
        return ResponseEntity.ok(ApiResponse.success(learningService.nextLesson(userId, words)));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponse<Void>> reset(@PathVariable String userId) {
        learningService.reset(userId);
        return ResponseEntity.ok(ApiResponse.success());
    }
}
