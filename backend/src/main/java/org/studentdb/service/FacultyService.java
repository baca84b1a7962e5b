package org.studentdb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.studentdb.dto.FacultyRequest;
import org.studentdb.entity.Faculty;
import org.studentdb.exception.ConstraintViolationException;
import org.studentdb.exception.PersistenceErrorTranslator;
import org.studentdb.repository.FacultyRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FacultyService {

    private final FacultyRepository facultyRepository;
    private final PersistenceErrorTranslator errorTranslator;

    @Transactional
    public Long createFaculty(FacultyRequest request) {
        if (request.getFullName() == null || request.getFullName().isBlank()) {
            throw ConstraintViolationException.required("Full name");
        }

        Faculty faculty = Faculty.builder()
            .fullName(request.getFullName().trim())
            .department(request.getDepartment())
            .email(request.getEmail() == null || request.getEmail().isBlank() ? null : request.getEmail().trim())
            .salary(request.getSalary())
            .hireDate(request.getHireDate())
            .build();

        Faculty saved;
        try {
            saved = facultyRepository.saveAndFlush(faculty);
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Faculty creation", e);
        }

        log.info("Faculty member created: id={}, department={}", saved.getId(), saved.getDepartment());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public List<Faculty> listFaculty(String department) {
        if (department == null || department.isBlank()) {
            return facultyRepository.findAllByOrderByIdAsc();
        }
        return facultyRepository.findByDepartmentOrderByFullNameAsc(department);
    }
}
