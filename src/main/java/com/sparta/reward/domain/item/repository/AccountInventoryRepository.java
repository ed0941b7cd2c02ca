package com.sparta.reward.domain.item.repository;

import com.sparta.reward.domain.item.entity.AccountInventory;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 계정 인벤토리 용량 저장소
 */
public interface AccountInventoryRepository extends JpaRepository<AccountInventory, String> {
}
