package com.my.reminder.domain.port.in;

import com.my.reminder.domain.model.Reminder;
import com.my.reminder.domain.model.ReminderDraft;

import java.util.List;

/**
 * 왜: 생성과 수정을 서로 다른 명시적 연산으로 노출해 입력 폼의 "편집 모드" 같은 암묵적 상태에 의존하지 않기 위함.
 */
public interface ReminderUseCase {

    Reminder create(ReminderDraft draft);

    Reminder update(String id, ReminderDraft draft);

    Reminder remove(String id);

    Reminder get(String id);

    List<Reminder> list();

    /**
     * 왜: 기동 시 저장된 알림을 복원하고, 지난 알림은 비활성으로 정규화한 뒤 남은 알림만 감시하기 위함.
     *
     * @return 감시를 시작한 알림 수
     */
    int loadAll();
}
