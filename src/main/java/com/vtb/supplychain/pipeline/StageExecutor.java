package com.vtb.supplychain.pipeline;

import java.time.Duration;

/**
 * Исполнитель этапа конвейера (уязвимости, репутация, код, supply chain, синтез).
 *
 * Реализация может распараллеливать работу внутри себя, но возвращает один
 * агрегированный результат. По истечении таймаута поток исполнителя прерывается,
 * а его результат отбрасывается.
 */
@FunctionalInterface
public interface StageExecutor {

    /**
     * @param input   пакеты, снимок накопленных находок и граф только для чтения
     * @param timeout время, отведенное этапу
     * @return новые находки (для синтеза - также {@link StageOutput#getSynthesis()})
     * @throws Exception любая ошибка внешнего источника; оркестратор ее перехватит
     */
    StageOutput execute(StageInput input, Duration timeout) throws Exception;
}
