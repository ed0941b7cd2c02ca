package com.sparta.reward.domain.character.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 계정이 보유한 플레이어 캐릭터
 */
@Entity
@Table(name = "account_characters", uniqueConstraints = {
        @UniqueConstraint(name = "uk_account_characters_account_character", columnNames = {"account_id", "character_key"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class AccountCharacter {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String accountCharacterId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "character_key", nullable = false)
    private String characterKey;

    @Column(name = "acquired_at")
    private LocalDateTime acquiredAt;

    @PrePersist
    protected void onCreate() {
        if (this.acquiredAt == null) {
            this.acquiredAt = LocalDateTime.now();
        }
    }

    public static AccountCharacter acquire(String accountId, String characterKey) {
        return AccountCharacter.builder()
                .accountId(accountId)
                .characterKey(characterKey)
                .build();
    }
}
