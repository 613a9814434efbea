package com.example.changefeed.repository;

import com.example.changefeed.model.domain.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    /**
     * Finds users whose username matches one of the given lower-cased names.
     *
     * @param usernames usernames, already lower-cased by the caller
     * @return the matching users, in no particular order
     */
    @Query("select u from AppUser u where lower(u.username) in :usernames")
    List<AppUser> findByLowerCaseUsernames(@Param("usernames") Collection<String> usernames);
}
