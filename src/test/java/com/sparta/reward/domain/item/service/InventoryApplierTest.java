package com.sparta.reward.domain.item.service;

import com.sparta.reward.domain.item.entity.EquipmentSlot;
import com.sparta.reward.domain.item.entity.InventoryItem;
import com.sparta.reward.domain.item.entity.ItemType;
import com.sparta.reward.domain.item.exception.InvalidItemQuantityException;
import com.sparta.reward.domain.item.repository.EquipmentSlotRepository;
import com.sparta.reward.domain.item.repository.InventoryItemRepository;
import com.sparta.reward.domain.item.repository.ItemTypeRepository;
import com.sparta.reward.domain.item.vo.SubOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * 인벤토리 아이템 변경 처리기 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("인벤토리 아이템 변경 처리기 테스트")
class InventoryApplierTest {

    private static final String ACCOUNT_ID = "A001";

    private static final ItemType POTION = ItemType.builder()
            .itemTypeKey("POTION").maxStack(99).requiresSlot(true).build();
    private static final ItemType SWORD = ItemType.builder()
            .itemTypeKey("SWORD").maxStack(1).requiresSlot(true).equipment(true)
            .subOptionPoolKey("WEAPON_POOL").subOptionCount(2).build();

    @Mock
    private InventoryItemRepository inventoryItemRepository;

    @Mock
    private ItemTypeRepository itemTypeRepository;

    @Mock
    private EquipmentSlotRepository equipmentSlotRepository;

    @Mock
    private SubOptionRoller subOptionRoller;

    @InjectMocks
    private InventoryApplier inventoryApplier;

    @Test
    @DisplayName("보유 스택에 추가하면 최대 스택으로 보정되고 초과분은 버려진다 (95 + 10 → 99)")
    void 최대스택_보정() {
        // given
        InventoryItem potion = InventoryItem.builder()
                .itemUid("UID-1").accountId(ACCOUNT_ID).itemTypeKey("POTION").amount(95).build();
        given(itemTypeRepository.findById("POTION")).willReturn(Optional.of(POTION));
        given(inventoryItemRepository.findFirstByAccountIdAndItemTypeKey(ACCOUNT_ID, "POTION"))
                .willReturn(Optional.of(potion));

        // when
        List<InventoryItem> changed = inventoryApplier.addItem(ACCOUNT_ID, "POTION", 10);

        // then
        assertThat(changed).containsExactly(potion);
        assertThat(potion.getAmount()).isEqualTo(99);
        verify(inventoryItemRepository).save(potion);
    }

    @Test
    @DisplayName("새 스택은 최대 스택으로 보정된 수량으로 생성된다")
    void 새스택_생성() {
        // given
        given(itemTypeRepository.findById("POTION")).willReturn(Optional.of(POTION));
        given(inventoryItemRepository.findFirstByAccountIdAndItemTypeKey(ACCOUNT_ID, "POTION"))
                .willReturn(Optional.empty());
        given(inventoryItemRepository.save(any(InventoryItem.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        List<InventoryItem> created = inventoryApplier.addItem(ACCOUNT_ID, "POTION", 150);

        // then
        assertThat(created).hasSize(1);
        assertThat(created.get(0).getAmount()).isEqualTo(99);
        assertThat(created.get(0).getOptions()).isEmpty();
        verifyNoInteractions(subOptionRoller);
    }

    @Test
    @DisplayName("스택 불가 아이템은 수량만큼 레코드가 생성되고 고정 옵션이 우선한다")
    void 스택불가_레코드생성_고정옵션() {
        // given
        given(itemTypeRepository.findById("SWORD")).willReturn(Optional.of(SWORD));
        given(subOptionRoller.roll(SWORD)).willReturn(List.of(
                new SubOption("HP", 10),
                new SubOption("DEF", 5)
        ));
        given(inventoryItemRepository.save(any(InventoryItem.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        List<InventoryItem> created = inventoryApplier.addItem(ACCOUNT_ID, "SWORD", 3, List.of(new SubOption("ATK", 50)));

        // then
        assertThat(created).hasSize(3)
                .allSatisfy(item -> {
                    assertThat(item.getAmount()).isEqualTo(1);
                    assertThat(item.getOptions()).containsExactly(new SubOption("ATK", 50), new SubOption("DEF", 5));
                });
        verify(inventoryItemRepository, times(3)).save(any(InventoryItem.class));
    }

    @Test
    @DisplayName("추가 수량이 0 이하면 예외가 발생한다")
    void 추가수량_검증() {
        // when & then
        assertThatThrownBy(() -> inventoryApplier.addItem(ACCOUNT_ID, "POTION", 0))
                .isInstanceOf(InvalidItemQuantityException.class);
    }

    @Test
    @DisplayName("보유량보다 많이 제거하거나 음수를 제거하면 false를 반환하고 변경하지 않는다")
    void 잘못된_제거() {
        // given
        InventoryItem potion = InventoryItem.builder()
                .itemUid("UID-1").accountId(ACCOUNT_ID).itemTypeKey("POTION").amount(3).build();

        // when & then
        assertThat(inventoryApplier.removeItem(potion, 4)).isFalse();
        assertThat(inventoryApplier.removeItem(potion, -1)).isFalse();
        assertThat(inventoryApplier.removeItem(null, 1)).isFalse();
        assertThat(potion.getAmount()).isEqualTo(3);
        verifyNoInteractions(inventoryItemRepository);
    }

    @Test
    @DisplayName("일부 제거하면 수량만 감소한다")
    void 일부_제거() {
        // given
        InventoryItem potion = InventoryItem.builder()
                .itemUid("UID-1").accountId(ACCOUNT_ID).itemTypeKey("POTION").amount(10).build();
        given(itemTypeRepository.findById("POTION")).willReturn(Optional.of(POTION));

        // when
        boolean removed = inventoryApplier.removeItem(potion, 4);

        // then
        assertThat(removed).isTrue();
        assertThat(potion.getAmount()).isEqualTo(6);
        verify(inventoryItemRepository).save(potion);
        verify(inventoryItemRepository, never()).delete(any());
    }

    @Test
    @DisplayName("수량이 0이 되면 레코드와 장착 정보가 함께 삭제된다")
    void 수량0_삭제() {
        // given
        InventoryItem sword = InventoryItem.builder()
                .itemUid("UID-SWORD").accountId(ACCOUNT_ID).itemTypeKey("SWORD").amount(1).build();
        EquipmentSlot slot = EquipmentSlot.builder()
                .equipmentSlotId("SLOT-1").accountId(ACCOUNT_ID).slotKey("WEAPON").itemUid("UID-SWORD").build();
        given(itemTypeRepository.findById("SWORD")).willReturn(Optional.of(SWORD));
        given(equipmentSlotRepository.findByItemUid("UID-SWORD")).willReturn(Optional.of(slot));

        // when
        boolean removed = inventoryApplier.removeItem(sword, 1);

        // then
        assertThat(removed).isTrue();
        assertThat(sword.getAmount()).isZero();
        verify(equipmentSlotRepository).delete(slot);
        verify(inventoryItemRepository).delete(sword);
        verify(inventoryItemRepository, never()).save(any());
    }
}
