package com.di.healthnova.profile;

import java.time.ZoneId;

/**
 * Source of per-user profile facts the core needs. The user directory itself is external.
 */
public interface UserProfileProvider {

    /** The user's default time zone; used for calendar days and for timestamps without an offset. */
    ZoneId zoneFor(String userId);
}
