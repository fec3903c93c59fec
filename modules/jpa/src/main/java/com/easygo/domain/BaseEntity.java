package com.easygo.domain;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Getter;

import java.time.ZonedDateTime;

/**
 * 모든 엔티티의 공통 상위 클래스.
 * <p>
 * 식별자(id)와 생성/수정/삭제 시각을 관리합니다.
 * 영속화 직전과 수정 직전에 {@link #guard()}를 호출하여
 * 하위 엔티티가 자신의 불변식을 검증할 수 있도록 합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@MappedSuperclass
@Getter
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private ZonedDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private ZonedDateTime updatedAt;

    @Column(name = "deleted_at")
    private ZonedDateTime deletedAt;

    /**
     * 엔티티 상태를 검증합니다.
     * <p>
     * 하위 클래스에서 필요 시 재정의합니다. 기본 구현은 아무것도 하지 않습니다.
     * </p>
     */
    protected void guard() {
    }

    @PrePersist
    private void prePersist() {
        guard();

        ZonedDateTime now = ZonedDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    private void preUpdate() {
        guard();

        this.updatedAt = ZonedDateTime.now();
    }

    /**
     * 엔티티를 논리 삭제합니다. 이미 삭제된 경우 무시합니다.
     */
    public void delete() {
        if (this.deletedAt == null) {
            this.deletedAt = ZonedDateTime.now();
        }
    }

    /**
     * 논리 삭제된 엔티티를 복원합니다.
     */
    public void restore() {
        if (this.deletedAt != null) {
            this.deletedAt = null;
        }
    }
}
