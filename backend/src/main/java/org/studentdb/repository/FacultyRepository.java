package org.studentdb.repository;

import org.studentdb.entity.Faculty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FacultyRepository extends JpaRepository<Faculty, Long> {
    List<Faculty> findAllByOrderByIdAsc();
    List<Faculty> findByDepartmentOrderByFullNameAsc(String department);
}
