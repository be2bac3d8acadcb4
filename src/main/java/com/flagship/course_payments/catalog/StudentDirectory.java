package com.flagship.course_payments.catalog;

import com.flagship.course_payments.exception.BusinessRuleViolationException;
import com.flagship.course_payments.exception.BusinessRuleViolationException.Rule;
import com.flagship.course_payments.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the student and educator directories.
 */
@Service
@RequiredArgsConstructor
public class StudentDirectory {

    private final StudentRepository studentRepository;
    private final EducatorRepository educatorRepository;

    /**
     * @throws ResourceNotFoundException if no such student exists
     * @throws BusinessRuleViolationException if the account is deactivated
     */
    @Transactional(readOnly = true)
    public Student getStudentById(UUID studentId) {
        Student student = studentRepository.findById(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("student", studentId));
        if (!student.isActive()) {
            throw new BusinessRuleViolationException(Rule.INACTIVE_ENTITY,
                    "Student " + studentId + " is not active");
        }
        return student;
    }

    @Transactional(readOnly = true)
    public Optional<Educator> findEducator(UUID educatorId) {
        return educatorRepository.findById(educatorId);
    }
}
