package org.studentdb.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.studentdb.dto.CourseRequest;
import org.studentdb.entity.Course;
import org.studentdb.service.CourseService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
@Tag(name = "Courses", description = "Course catalogue")
public class CourseController {

    private final CourseService courseService;

    @PostMapping
    @Operation(summary = "Create a course")
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CourseRequest request) {
        Long id = courseService.createCourse(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @GetMapping
    @Operation(summary = "List courses", description = "Filter by code when given")
    public ResponseEntity<List<Course>> list(@RequestParam(required = false) String code) {
        if (code != null) {
            return ResponseEntity.ok(List.of(courseService.findByCode(code)));
        }
        return ResponseEntity.ok(courseService.listCourses());
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a course", description = "Enrollments in the course are deleted with it")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        courseService.deleteCourse(id);
        return ResponseEntity.noContent().build();
    }
}
