package org.studentdb.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.studentdb.dto.FacultyRequest;
import org.studentdb.entity.Faculty;
import org.studentdb.service.FacultyService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/faculty")
@RequiredArgsConstructor
@Tag(name = "Faculty", description = "Teaching staff")
public class FacultyController {

    private final FacultyService facultyService;

    @PostMapping
    @Operation(summary = "Add a faculty member")
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody FacultyRequest request) {
        Long id = facultyService.createFaculty(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @GetMapping
    @Operation(summary = "List faculty", description = "Optionally filtered by department")
    public ResponseEntity<List<Faculty>> list(@RequestParam(required = false) String department) {
        return ResponseEntity.ok(facultyService.listFaculty(department));
    }
}
