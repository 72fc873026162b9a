package com.jquest.api.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import com.jquest.api.annotation.BlankAllowed;

import java.util.ArrayList;
import java.util.List;

/**
 * A deployment of the game. Missions are grouped by instance.
 */
@Entity
@Table(name = "instance")
@Getter
@Setter
@NoArgsConstructor
public class Instance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 100)
    @Column(nullable = false, length = 100)
    private String name;

    @NotBlank
    @Pattern(regexp = "[-a-zA-Z0-9_]+", message = "must be a valid slug")
    @Column(nullable = false, unique = true, length = 100)
    private String slug;

    @BlankAllowed
    private String host;

    @BlankAllowed
    @Column(length = 2000)
    private String description;

    @OneToMany(mappedBy = "instance")
    private List<Mission> missions = new ArrayList<>();
}
