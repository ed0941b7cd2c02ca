package com.sparta.reward.domain.item.entity;

import com.sparta.reward.domain.item.exception.InvalidItemQuantityException;
import com.sparta.reward.domain.item.vo.SubOption;
import com.sparta.reward.infrastructure.jpa.BaseEntity;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 인벤토리 아이템 레코드
 * 스택 불가 아이템은 레코드 1개가 1개 수량, 1슬롯을 차지한다
 */
@Entity
@Table(name = "inventory_items", indexes = {
        @Index(name = "idx_inventory_items_account_type", columnList = "account_id, item_type_key")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class InventoryItem extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String itemUid;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "item_type_key", nullable = false)
    private String itemTypeKey;

    @Column(name = "amount", nullable = false)
    private int amount;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "inventory_item_options", joinColumns = @JoinColumn(name = "item_id"))
    @OrderColumn(name = "seq")
    private List<SubOption> options = new ArrayList<>();

    @Version
    private Long version;

    public static InventoryItem create(String accountId, String itemTypeKey, int amount) {
        return InventoryItem.builder()
                .accountId(accountId)
                .itemTypeKey(itemTypeKey)
                .amount(amount)
                .build();
    }

    /**
     * 수량 변경 (보정은 호출자가 수행)
     */
    public void changeAmount(int newAmount) {
        if (newAmount < 0) {
            throw new InvalidItemQuantityException("아이템 수량은 음수일 수 없습니다");
        }
        this.amount = newAmount;
    }

    public void replaceOptions(List<SubOption> newOptions) {
        this.options.clear();
        this.options.addAll(newOptions);
    }

    public boolean isOwnedBy(String accountId) {
        return this.accountId.equals(accountId);
    }
}
