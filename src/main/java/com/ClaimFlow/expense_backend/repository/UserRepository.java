package com.ClaimFlow.expense_backend.repository;

import com.ClaimFlow.expense_backend.enums.Role;
import com.ClaimFlow.expense_backend.model.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {
    Optional<User> findByUsername(String username);
    Optional<User> findByEmail(String email);

    @Query("SELECT u FROM User u WHERE LOWER(u.username) = LOWER(:login) OR LOWER(u.email) = LOWER(:login)")
    Optional<User> findByLogin(@Param("login") String login);

    boolean existsByUsername(String username);
    boolean existsByEmail(String email);

    List<User> findAllByRoleAndActiveTrue(Role role);

    @Query("SELECT u.employeeCode FROM User u WHERE u.employeeCode LIKE 'EMP%'")
    List<String> findAllEmployeeCodes();

    // COALESCE keeps PostgreSQL from rejecting an untyped null search parameter
    @Query("SELECT u FROM User u WHERE " +
            "(COALESCE(:search, '') = '' OR " +
            "LOWER(u.fullName) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(u.username) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(u.email) LIKE LOWER(CONCAT('%', :search, '%'))) AND " +
            "(:role IS NULL OR u.role = :role)")
    Page<User> searchUsers(@Param("search") String search,
                           @Param("role") Role role,
                           Pageable pageable);

    long countByRoleAndActiveTrue(Role role);

    long countByActiveTrue();

    @Query("SELECT u.role, COUNT(u) FROM User u GROUP BY u.role")
    List<Object[]> countByRole();

    @Query("SELECT u.grade, COUNT(u) FROM User u GROUP BY u.grade")
    List<Object[]> countByGrade();
}
