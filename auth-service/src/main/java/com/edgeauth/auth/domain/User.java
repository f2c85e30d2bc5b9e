package com.edgeauth.auth.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(nullable = false)
    private String passwordHash;

    @Column(nullable = false)
    private boolean admin;

    private LocalDateTime deletedAt;

    @Builder
    private User(String email, String name, String passwordHash, boolean admin) {
        this.email = email;
        this.name = name;
        this.passwordHash = passwordHash;
        this.admin = admin;
    }

    public void updateProfile(String email, String name) {
        this.email = email;
        this.name = name;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public void softDelete(LocalDateTime at) {
        this.deletedAt = at;
    }
}
