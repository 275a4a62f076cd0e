package com.wzz.fulfillcrm.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.wzz.fulfillcrm.entity.ProductStock;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ProductStockMapper extends BaseMapper<ProductStock> {

    /**
     * 按商品、库位、批次查询库存行并加排他锁，同一库存行的移动由此串行化
     * @param batchNumber 批次号，无批次传空串
     */
    @Select("SELECT * FROM product_stock WHERE product_id = #{productId} "
            + "AND storage_location_id = #{locationId} AND batch_number = #{batchNumber} FOR UPDATE")
    ProductStock selectForUpdate(@Param("productId") Long productId,
                                 @Param("locationId") Long locationId,
                                 @Param("batchNumber") String batchNumber);

    /**
     * 库位上所有商品的在库总数
     */
    @Select("SELECT COALESCE(SUM(quantity), 0) FROM product_stock WHERE storage_location_id = #{locationId}")
    long sumQuantityByLocation(@Param("locationId") Long locationId);
}
