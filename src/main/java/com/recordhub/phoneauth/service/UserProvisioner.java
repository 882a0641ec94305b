package com.recordhub.phoneauth.service;

import com.recordhub.phoneauth.model.User;

/**
 * Resolves a verified phone number to an account.
 */
public interface UserProvisioner {

    /**
     * Returns the user owning the phone number, creating it if absent, with the login recorded.
     */
    User provision(String phoneNumber);
}
