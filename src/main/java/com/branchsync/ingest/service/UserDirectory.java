package com.branchsync.ingest.service;

import com.branchsync.ingest.error.IdentityLookupException;
import com.branchsync.ingest.model.ResolvedIdentity;

import java.util.Optional;

/**
 * Maps a branch-local enroll number (and admission number when the source carries one)
 * to a platform user. Empty means "nobody mapped"; lookup failures raise
 * {@link IdentityLookupException}.
 */
public interface UserDirectory {

    Optional<ResolvedIdentity> resolveIdentity(String branchId, String enrollNumber, String admissionNumber);
}
