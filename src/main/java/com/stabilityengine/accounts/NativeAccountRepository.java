package com.stabilityengine.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for native account persistence.
 */
@Repository
public interface NativeAccountRepository extends JpaRepository<NativeAccount, String> {
}
