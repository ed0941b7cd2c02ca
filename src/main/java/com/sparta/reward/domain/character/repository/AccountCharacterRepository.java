package com.sparta.reward.domain.character.repository;

import com.sparta.reward.domain.character.entity.AccountCharacter;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 보유 캐릭터 저장소
 */
public interface AccountCharacterRepository extends JpaRepository<AccountCharacter, String> {

    boolean existsByAccountIdAndCharacterKey(String accountId, String characterKey);
}
