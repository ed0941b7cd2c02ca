package com.sparta.reward.domain.item.repository;

import com.sparta.reward.domain.item.entity.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * 인벤토리 아이템 저장소
 */
public interface InventoryItemRepository extends JpaRepository<InventoryItem, String> {

    /**
     * 슬롯을 차지하는 아이템 레코드 수
     * 스택 불가 레코드는 수량 1, 스택 레코드는 수량과 관계없이 1슬롯이므로 레코드 수 = 슬롯 수
     */
    @Query("SELECT COUNT(i) FROM InventoryItem i WHERE i.accountId = :accountId " +
           "AND i.itemTypeKey IN (SELECT t.itemTypeKey FROM ItemType t WHERE t.requiresSlot = true)")
    long countOccupiedSlots(@Param("accountId") String accountId);

    /**
     * 아이템 타입별 보유 수량 합계
     */
    @Query("SELECT COALESCE(SUM(i.amount), 0) FROM InventoryItem i " +
           "WHERE i.accountId = :accountId AND i.itemTypeKey = :itemTypeKey")
    long sumAmount(@Param("accountId") String accountId, @Param("itemTypeKey") String itemTypeKey);

    Optional<InventoryItem> findFirstByAccountIdAndItemTypeKey(String accountId, String itemTypeKey);

    List<InventoryItem> findByAccountIdAndItemTypeKeyOrderByCreatedAtAsc(String accountId, String itemTypeKey);

    List<InventoryItem> findByAccountIdOrderByCreatedAtAsc(String accountId);
}
