package com.flagship.course_payments.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface EducatorRepository extends JpaRepository<Educator, UUID> {
}
