package org.studentdb.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseRequest {

    @NotBlank(message = "Course name must not be empty")
    @Size(max = 150, message = "Course name must be at most 150 characters")
    private String name;

    @Size(max = 20, message = "Code must be at most 20 characters")
    private String code;

    @NotNull(message = "Credits are required")
    private Integer credits;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;
}
