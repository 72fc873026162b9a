package com.jquest.api.domain.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import com.jquest.api.annotation.BlankAllowed;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * A player or staff account. Published as the {@code user} resource.
 */
@Entity
@Table(name = "account")
@Getter
@Setter
@NoArgsConstructor
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 150)
    @Pattern(regexp = "[\\w.@+-]+", message = "may only contain letters, digits and @/./+/-/_")
    @Column(nullable = false, unique = true, length = 150)
    private String username;

    @BlankAllowed
    @Column(length = 150)
    private String firstName;

    @BlankAllowed
    @Column(length = 150)
    private String lastName;

    @BlankAllowed
    private String email;

    @Column(nullable = false)
    private String password;

    @Column(nullable = false)
    private Boolean isActive = Boolean.TRUE;

    @Column(nullable = false)
    private Boolean isStaff = Boolean.FALSE;

    @Column(nullable = false)
    private Boolean isSuperuser = Boolean.FALSE;

    @Column(nullable = false)
    private LocalDateTime dateJoined;

    private LocalDateTime lastLogin;

    /** Model permissions such as {@code mission.add}. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "account_permission", joinColumns = @JoinColumn(name = "account_id"))
    @Column(name = "permission", nullable = false)
    private Set<String> permissions = new HashSet<>();

    public Account(String username) {
        this.username = username;
    }

    @PrePersist
    void onCreate() {
        if (dateJoined == null) {
            dateJoined = LocalDateTime.now();
        }
    }
}
